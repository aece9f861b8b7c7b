package com.sysmlgraph.graph.driver;

import com.sysmlgraph.graph.GraphProperties;
import com.sysmlgraph.graph.SysmlEdge;
import com.sysmlgraph.graph.SysmlNode;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for the model graph.
 *
 * <p>Implementations encapsulate how nodes and relationships are stored so the model and diagram
 * services stay store-agnostic and can switch drivers via configuration ({@code graph.driver}).
 * Nodes and relationships are addressed by their {@code id} property. Merges follow the graph
 * store's {@code SET n += $props} semantics: a {@link
 * com.sysmlgraph.graph.PropertyValue.Cleared} value removes the property.
 */
public interface GraphDriver extends AutoCloseable {

  /** Initialize the driver and any underlying connections/resources. */
  void initialize();

  /** @return true when the driver is ready to accept operations. */
  boolean isInitialized();

  /** Remove all nodes and relationships. */
  void clearAll();

  /**
   * Persist a new node.
   *
   * @throws com.sysmlgraph.exception.AlreadyExistsException if a node with the same id exists
   */
  void createNode(SysmlNode node);

  Optional<SysmlNode> findNode(String id);

  /** Nodes carrying the label, in creation order. */
  List<SysmlNode> findNodesByLabel(String label);

  /** @return false when no node has the id */
  boolean mergeNodeProperties(String id, GraphProperties updates);

  /**
   * Delete the node and every relationship attached to it.
   *
   * @return false when no node has the id
   */
  boolean deleteNode(String id);

  /**
   * Persist a new relationship between two existing nodes.
   *
   * @return false when the source or the target node does not exist
   * @throws com.sysmlgraph.exception.AlreadyExistsException if a relationship with the same id
   *     exists
   */
  boolean createEdge(SysmlEdge edge);

  Optional<SysmlEdge> findEdge(String id);

  /** Relationships whose type is one of {@code relTypes}; all of them when empty. */
  List<SysmlEdge> findEdges(Collection<String> relTypes);

  /** Outgoing relationships of a node whose type is one of {@code relTypes}. */
  List<SysmlEdge> findOutgoingEdges(String nodeId, Collection<String> relTypes);

  /** @return false when no relationship has the id */
  boolean mergeEdgeProperties(String id, GraphProperties updates);

  /** @return false when no relationship has the id */
  boolean deleteEdge(String id);

  /** @return logical driver identifier (e.g., {@code in-memory}). */
  String getDriverName();

  /** @return name of the graph (database) this driver works on. */
  String getGraphName();

  /** Shut down the driver and release resources. */
  void shutdown();

  @Override
  default void close() {
    shutdown();
  }
}
