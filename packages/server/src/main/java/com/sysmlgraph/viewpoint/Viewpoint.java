package com.sysmlgraph.viewpoint;

import java.util.List;
import java.util.Objects;

/**
 * Named filter selecting the element and relationship kinds relevant to one engineering concern.
 *
 * <p>Instances are immutable: the kind lists are copied on construction. A viewpoint created
 * without edge kinds has an empty {@link #includeEdgeKinds()} list.
 */
public record Viewpoint(
    String id,
    String name,
    String description,
    List<String> includeNodeKinds,
    List<String> includeEdgeKinds) {

  public Viewpoint {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    includeNodeKinds = List.copyOf(includeNodeKinds);
    includeEdgeKinds = includeEdgeKinds == null ? List.of() : List.copyOf(includeEdgeKinds);
  }

  public Viewpoint(String id, String name, String description, List<String> includeNodeKinds) {
    this(id, name, description, includeNodeKinds, null);
  }

  public boolean includesNodeKind(String kind) {
    return includeNodeKinds.contains(kind);
  }

  public boolean includesEdgeKind(String kind) {
    return includeEdgeKinds.contains(kind);
  }
}
