package com.sysmlgraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** Ordered, flat property mapping of a node or relationship. */
public final class GraphProperties {
  private final Map<String, PropertyValue> values = new LinkedHashMap<>();

  public GraphProperties() {}

  /** Wrap a property map as returned by a graph store. */
  public static GraphProperties fromMap(Map<String, ?> raw) {
    GraphProperties props = new GraphProperties();
    if (raw != null) {
      raw.forEach((k, v) -> props.put(k, PropertyValue.fromStorage(v)));
    }
    return props;
  }

  public GraphProperties put(String key, PropertyValue value) {
    values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    return this;
  }

  public GraphProperties putText(String key, String value) {
    return put(key, PropertyValue.text(value));
  }

  public Optional<PropertyValue> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  /** String form of the property; empty when absent or cleared. */
  public Optional<String> getString(String key) {
    PropertyValue v = values.get(key);
    return v == null ? Optional.empty() : Optional.ofNullable(v.asString());
  }

  public boolean containsKey(String key) {
    return values.containsKey(key);
  }

  public GraphProperties remove(String key) {
    values.remove(key);
    return this;
  }

  public Set<String> keys() {
    return Collections.unmodifiableSet(values.keySet());
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public Map<String, PropertyValue> asMap() {
    return Collections.unmodifiableMap(values);
  }

  /**
   * Apply {@code updates} the way a graph store applies {@code SET n += $props}: values replace
   * existing ones, {@link PropertyValue.Cleared} removes the property.
   */
  public GraphProperties mergeFrom(GraphProperties updates) {
    updates.values.forEach(
        (k, v) -> {
          if (v instanceof PropertyValue.Cleared) {
            values.remove(k);
          } else {
            values.put(k, v);
          }
        });
    return this;
  }

  public GraphProperties copy() {
    GraphProperties c = new GraphProperties();
    c.values.putAll(values);
    return c;
  }

  /** Plain map for a graph store; cleared values map to {@code null}. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    values.forEach((k, v) -> map.put(k, v.toStorage()));
    return map;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof GraphProperties other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
