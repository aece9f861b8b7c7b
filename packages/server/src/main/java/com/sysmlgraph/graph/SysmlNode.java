package com.sysmlgraph.graph;

import com.sysmlgraph.mapping.KindTranslator;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A vertex of the model graph: a set of labels plus flat properties.
 *
 * <p>Element nodes carry exactly two labels, the generic {@value KindTranslator#ELEMENT_LABEL}
 * label first and the kind-specific label second. Other node types (diagrams) carry one label.
 * Instances are immutable; properties are copied in and out.
 */
public final class SysmlNode {
  private final List<String> labels;
  private final GraphProperties properties;

  public SysmlNode(List<String> labels, GraphProperties properties) {
    if (labels == null || labels.isEmpty()) {
      throw new IllegalArgumentException("Node must carry at least one label");
    }
    this.labels = List.copyOf(labels);
    this.properties = Objects.requireNonNull(properties, "properties").copy();
  }

  /** Element node for a kebab-case kind. */
  public static SysmlNode element(String kind, GraphProperties properties) {
    return new SysmlNode(KindTranslator.getNodeLabels(kind), properties);
  }

  public String getId() {
    return properties.getString("id").orElse(null);
  }

  public List<String> getLabels() {
    return labels;
  }

  public boolean hasLabel(String label) {
    return labels.contains(label);
  }

  public boolean hasAnyLabel(Collection<String> candidates) {
    for (String label : labels) {
      if (candidates.contains(label)) return true;
    }
    return false;
  }

  public boolean isElement() {
    return hasLabel(KindTranslator.ELEMENT_LABEL);
  }

  /** Kebab-case kind derived from the specific label; empty for non-element nodes. */
  public Optional<String> getKind() {
    if (!isElement()) return Optional.empty();
    return labels.stream()
        .filter(l -> !KindTranslator.ELEMENT_LABEL.equals(l))
        .findFirst()
        .map(KindTranslator::labelToNodeKind);
  }

  public GraphProperties getProperties() {
    return properties.copy();
  }

  public Optional<String> getString(String key) {
    return properties.getString(key);
  }

  public SysmlNode withProperties(GraphProperties replacement) {
    return new SysmlNode(labels, replacement);
  }

  /** Convert this node to a map suitable for a graph store client. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = properties.toMap();
    map.put("labels", labels);
    return map;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof SysmlNode other
        && labels.equals(other.labels)
        && properties.equals(other.properties);
  }

  @Override
  public int hashCode() {
    return Objects.hash(labels, properties);
  }

  @Override
  public String toString() {
    return "SysmlNode{labels=" + labels + ", properties=" + properties + '}';
  }
}
