package com.sysmlgraph.viewpoint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/** Node and edge kinds a client may create while working in a viewpoint. */
public record ViewpointTypes(List<String> nodeKinds, List<String> edgeKinds) {

  public static final ViewpointTypes EMPTY = new ViewpointTypes(List.of(), List.of());

  public ViewpointTypes {
    nodeKinds = List.copyOf(nodeKinds);
    edgeKinds = List.copyOf(edgeKinds);
  }

  @JsonIgnore
  public boolean isEmpty() {
    return nodeKinds.isEmpty() && edgeKinds.isEmpty();
  }
}
