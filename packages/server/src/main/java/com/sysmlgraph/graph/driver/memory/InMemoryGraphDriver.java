package com.sysmlgraph.graph.driver.memory;

import com.sysmlgraph.exception.AlreadyExistsException;
import com.sysmlgraph.exception.StateException;
import com.sysmlgraph.graph.GraphProperties;
import com.sysmlgraph.graph.SysmlEdge;
import com.sysmlgraph.graph.SysmlNode;
import com.sysmlgraph.graph.driver.GraphDriver;
import com.sysmlgraph.logging.LoggingService;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Graph driver keeping nodes and relationships in memory.
 *
 * <p>Used when no external graph store is configured and in tests. Iteration order is creation
 * order. Every operation takes a single lock, so multi-step mutations such as a detach delete
 * are atomic.
 */
public class InMemoryGraphDriver implements GraphDriver {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(InMemoryGraphDriver.class);

  public static final String DRIVER_NAME = "in-memory";

  private final String graphName;
  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, SysmlNode> nodes = new LinkedHashMap<>();
  private final Map<String, SysmlEdge> edges = new LinkedHashMap<>();

  public InMemoryGraphDriver(String graphName) {
    this.graphName = graphName != null && !graphName.isBlank() ? graphName : "default";
  }

  @Override
  public void initialize() {
    if (initialized.compareAndSet(false, true)) {
      log.info("InMemoryGraphDriver initialized for graph '{}'", graphName);
    }
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public void clearAll() {
    ensureInitialized();
    lock.lock();
    try {
      log.debug("Clearing {} nodes and {} relationships", nodes.size(), edges.size());
      nodes.clear();
      edges.clear();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void createNode(SysmlNode node) {
    ensureInitialized();
    String id = node.getId();
    if (id == null || id.isEmpty()) {
      throw new IllegalArgumentException("Node must have an id property");
    }
    lock.lock();
    try {
      if (nodes.containsKey(id)) {
        throw new AlreadyExistsException("Node already exists: " + id, Map.of("id", id));
      }
      nodes.put(id, node.withProperties(withoutCleared(node.getProperties())));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<SysmlNode> findNode(String id) {
    ensureInitialized();
    lock.lock();
    try {
      return Optional.ofNullable(nodes.get(id));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<SysmlNode> findNodesByLabel(String label) {
    ensureInitialized();
    lock.lock();
    try {
      return nodes.values().stream().filter(n -> n.hasLabel(label)).collect(Collectors.toList());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean mergeNodeProperties(String id, GraphProperties updates) {
    ensureInitialized();
    lock.lock();
    try {
      SysmlNode current = nodes.get(id);
      if (current == null) return false;
      GraphProperties merged = current.getProperties().mergeFrom(updates);
      nodes.put(id, current.withProperties(merged));
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean deleteNode(String id) {
    ensureInitialized();
    lock.lock();
    try {
      if (nodes.remove(id) == null) return false;
      int before = edges.size();
      edges.values().removeIf(e -> e.getFromId().equals(id) || e.getToId().equals(id));
      log.debug("Deleted node {} and {} attached relationships", id, before - edges.size());
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean createEdge(SysmlEdge edge) {
    ensureInitialized();
    lock.lock();
    try {
      if (!nodes.containsKey(edge.getFromId()) || !nodes.containsKey(edge.getToId())) {
        log.debug("Not creating {}: endpoint missing", edge);
        return false;
      }
      if (edges.containsKey(edge.getId())) {
        throw new AlreadyExistsException(
            "Relationship already exists: " + edge.getId(), Map.of("id", edge.getId()));
      }
      edges.put(edge.getId(), edge.withProperties(withoutCleared(edge.getProperties())));
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<SysmlEdge> findEdge(String id) {
    ensureInitialized();
    lock.lock();
    try {
      return Optional.ofNullable(edges.get(id));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<SysmlEdge> findEdges(Collection<String> relTypes) {
    return selectEdges(typeFilter(relTypes));
  }

  @Override
  public List<SysmlEdge> findOutgoingEdges(String nodeId, Collection<String> relTypes) {
    Predicate<SysmlEdge> byType = typeFilter(relTypes);
    return selectEdges(e -> e.getFromId().equals(nodeId) && byType.test(e));
  }

  @Override
  public boolean mergeEdgeProperties(String id, GraphProperties updates) {
    ensureInitialized();
    lock.lock();
    try {
      SysmlEdge current = edges.get(id);
      if (current == null) return false;
      GraphProperties merged = current.getProperties().mergeFrom(updates);
      edges.put(id, current.withProperties(merged));
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean deleteEdge(String id) {
    ensureInitialized();
    lock.lock();
    try {
      return edges.remove(id) != null;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String getDriverName() {
    return DRIVER_NAME;
  }

  @Override
  public String getGraphName() {
    return graphName;
  }

  @Override
  public void shutdown() {
    if (initialized.compareAndSet(true, false)) {
      log.info("InMemoryGraphDriver for graph '{}' shut down", graphName);
    }
  }

  private List<SysmlEdge> selectEdges(Predicate<SysmlEdge> filter) {
    ensureInitialized();
    lock.lock();
    try {
      return edges.values().stream().filter(filter).collect(Collectors.toList());
    } finally {
      lock.unlock();
    }
  }

  /** A created entity starts empty, so cleared values simply do not exist on it. */
  private static GraphProperties withoutCleared(GraphProperties props) {
    return new GraphProperties().mergeFrom(props);
  }

  private static Predicate<SysmlEdge> typeFilter(Collection<String> relTypes) {
    if (relTypes == null || relTypes.isEmpty()) return e -> true;
    Set<String> types = Set.copyOf(relTypes);
    return e -> types.contains(e.getRelType());
  }

  private void ensureInitialized() {
    if (!initialized.get()) {
      throw new StateException("Graph driver '" + graphName + "' is not initialized");
    }
  }

  @Override
  public String toString() {
    return "InMemoryGraphDriver{graph=" + graphName + ", nodes=" + nodes.size() + ", edges="
        + edges.size() + '}';
  }
}
