package com.sysmlgraph.graph.driver.spi;

import com.sysmlgraph.graph.driver.GraphDriver;
import org.apache.commons.configuration2.Configuration;

/**
 * Service provider for {@link GraphDriver} implementations, discovered through {@link
 * java.util.ServiceLoader}. Register implementations in {@code
 * META-INF/services/com.sysmlgraph.graph.driver.spi.GraphDriverProvider}.
 */
public interface GraphDriverProvider {

  /** Identifier matched against the {@code graph.driver} configuration key. */
  String id();

  /** Whether the driver can be created with the given configuration. */
  boolean isAvailable(Configuration configuration);

  GraphDriver create(Configuration configuration, String graphName);
}
