package com.sysmlgraph.graph;

import com.sysmlgraph.mapping.KindTranslator;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A directed relationship of the model graph.
 *
 * <p>The relationship type is stored in the graph store's convention (uppercase, underscores,
 * e.g. {@code CONTROL_FLOW}); use {@link #relationship} to build one from a kebab-case edge kind.
 * Every edge has an id, which the store uses to address it for updates and deletes.
 */
public final class SysmlEdge {
  private final String id;
  private final String relType;
  private final String fromId;
  private final String toId;
  private final GraphProperties properties;

  public SysmlEdge(
      String id, String relType, String fromId, String toId, GraphProperties properties) {
    if (relType == null || relType.trim().isEmpty()) {
      throw new IllegalArgumentException("Relationship type cannot be null or empty");
    }
    this.id = Objects.requireNonNull(id, "id");
    this.relType = relType.trim().toUpperCase(Locale.ROOT);
    this.fromId = Objects.requireNonNull(fromId, "fromId");
    this.toId = Objects.requireNonNull(toId, "toId");
    this.properties = properties == null ? new GraphProperties() : properties.copy();
  }

  public static SysmlEdge relationship(
      String id, String edgeKind, String fromId, String toId, GraphProperties properties) {
    return new SysmlEdge(id, KindTranslator.edgeKindToRelType(edgeKind), fromId, toId, properties);
  }

  public String getId() {
    return id;
  }

  public String getRelType() {
    return relType;
  }

  public String getEdgeKind() {
    return KindTranslator.relTypeToEdgeKind(relType);
  }

  public String getFromId() {
    return fromId;
  }

  public String getToId() {
    return toId;
  }

  public GraphProperties getProperties() {
    return properties.copy();
  }

  public SysmlEdge withProperties(GraphProperties replacement) {
    return new SysmlEdge(id, relType, fromId, toId, replacement);
  }

  /** Convert this edge to a map suitable for a graph store client. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = properties.toMap();
    map.put("id", id);
    map.put("type", relType);
    map.put("source", fromId);
    map.put("target", toId);
    return map;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof SysmlEdge other
        && id.equals(other.id)
        && relType.equals(other.relType)
        && fromId.equals(other.fromId)
        && toId.equals(other.toId)
        && properties.equals(other.properties);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, relType, fromId, toId, properties);
  }

  @Override
  public String toString() {
    return "SysmlEdge{" + fromId + " -[" + relType + ":" + id + "]-> " + toId + '}';
  }
}
