package com.sysmlgraph.graph.driver.providers;

import com.sysmlgraph.graph.driver.GraphDriver;
import com.sysmlgraph.graph.driver.memory.InMemoryGraphDriver;
import com.sysmlgraph.graph.driver.spi.GraphDriverProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the in-memory GraphDriver. Always available. */
public class InMemoryGraphDriverProvider implements GraphDriverProvider {
  @Override
  public String id() {
    return InMemoryGraphDriver.DRIVER_NAME;
  }

  @Override
  public boolean isAvailable(Configuration configuration) {
    return true;
  }

  @Override
  public GraphDriver create(Configuration configuration, String graphName) {
    return new InMemoryGraphDriver(graphName);
  }
}
