package com.sysmlgraph;

import com.sysmlgraph.diagram.DiagramService;
import com.sysmlgraph.exception.ErrorDetails;
import com.sysmlgraph.exception.ExceptionUtil;
import com.sysmlgraph.exception.StateException;
import com.sysmlgraph.graph.driver.GraphDriver;
import com.sysmlgraph.graph.driver.memory.InMemoryGraphDriver;
import com.sysmlgraph.graph.driver.spi.GraphDriverProvider;
import com.sysmlgraph.logging.LoggingService;
import com.sysmlgraph.model.ModelService;
import com.sysmlgraph.model.ModelSettings;
import java.time.Clock;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context: loads configuration, applies log levels, resolves the graph driver and
 * builds the model and diagram services on top of it.
 *
 * <p>Typical use:
 *
 * <pre>{@code
 * try (SysmlGraph graph = new SysmlGraph("classpath:application.yaml")) {
 *   graph.initialize();
 *   graph.modelService().fetchModel("sysml.requirement");
 * }
 * }</pre>
 */
public class SysmlGraph implements AutoCloseable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(SysmlGraph.class);

  public static final String DRIVER_KEY = "graph.driver";
  public static final String GRAPH_NAME_KEY = "graph.name";
  public static final String DEFAULT_GRAPH_NAME = "sysml";

  private final String configLocation;
  private final Clock clock;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile ConfigurationProvider configurationProvider;
  private volatile GraphDriver driver;
  private volatile ModelService modelService;
  private volatile DiagramService diagramService;

  public SysmlGraph(String configLocation) {
    this(configLocation, Clock.systemUTC());
  }

  public SysmlGraph(String configLocation, Clock clock) {
    this.configLocation = configLocation;
    this.clock = clock;
  }

  public synchronized void initialize() {
    if (driver != null) return;
    try {
      ConfigurationProvider provider = new ConfigurationProvider(configLocation);
      Configuration cfg = provider.config();
      // Apply logging levels from application.yaml as early as possible
      LoggingService.applyConfiguration(cfg);

      GraphDriver resolved = resolveDriver(cfg);
      resolved.initialize();
      this.modelService = new ModelService(resolved, clock, ModelSettings.from(cfg));
      this.diagramService = new DiagramService(resolved, clock);
      this.configurationProvider = provider;
      // Published last: a non-null driver marks the context as initialized
      this.driver = resolved;
    } catch (RuntimeException e) {
      ErrorDetails details = ExceptionUtil.toErrorDetails(e, clock);
      log.error(
          "SysML graph initialization failed [{}] {}: {}",
          details.code,
          details.type,
          details.message);
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new StateException("Failed to initialize SysML graph", ex));
    }
    log.info(
        "SysML graph '{}' ready on driver '{}'", driver.getGraphName(), driver.getDriverName());
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("SysmlGraph not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public GraphDriver driver() {
    return require(driver);
  }

  public ModelService modelService() {
    return require(modelService);
  }

  public DiagramService diagramService() {
    return require(diagramService);
  }

  private <T> T require(T component) {
    if (component == null) {
      throw new StateException("SysmlGraph not initialized. Call initialize() first.");
    }
    return component;
  }

  /**
   * Pick the provider whose id matches {@value #DRIVER_KEY}; fall back to the in-memory provider,
   * then to a direct in-memory instance.
   */
  static GraphDriver resolveDriver(Configuration cfg) {
    String graphName = cfg.getString(GRAPH_NAME_KEY, DEFAULT_GRAPH_NAME);
    String desired = cfg.getString(DRIVER_KEY, InMemoryGraphDriver.DRIVER_NAME);
    log.trace("Resolving graph driver for graph '{}' (desired '{}')", graphName, desired);
    try {
      ServiceLoader<GraphDriverProvider> loader = ServiceLoader.load(GraphDriverProvider.class);
      for (GraphDriverProvider p : loader) {
        if (p.id().equalsIgnoreCase(desired) && p.isAvailable(cfg)) {
          return p.create(cfg, graphName);
        }
      }
      log.warn("Graph driver '{}' is not available; falling back to in-memory", desired);
      for (GraphDriverProvider p : loader) {
        if (p.id().equalsIgnoreCase(InMemoryGraphDriver.DRIVER_NAME)) {
          return p.create(cfg, graphName);
        }
      }
    } catch (ServiceConfigurationError e) {
      log.warn("Failed to load graph driver providers: {}", e.getMessage(), e);
    }
    return new InMemoryGraphDriver(graphName);
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true) && driver != null) {
      driver.shutdown();
    }
  }
}
