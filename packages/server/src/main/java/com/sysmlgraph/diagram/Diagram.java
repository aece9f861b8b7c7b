package com.sysmlgraph.diagram;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sysmlgraph.spec.Position;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named canvas showing a subset of the model.
 *
 * @param viewpointId viewpoint the diagram was drawn in; empty when none
 * @param elementIds ids of the shown elements, in the order they were added
 * @param positions canvas position per element id
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Diagram(
    String id,
    String name,
    String viewpointId,
    List<String> elementIds,
    Map<String, Position> positions,
    String createdAt,
    String updatedAt) {

  public Diagram {
    elementIds = elementIds != null ? List.copyOf(elementIds) : List.of();
    positions =
        positions != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(positions))
            : Map.of();
  }

  /** Draft for {@link DiagramService#createDiagram}; missing values get defaults. */
  public static Diagram draft(String name, String viewpointId) {
    return new Diagram(null, name, viewpointId, List.of(), Map.of(), null, null);
  }
}
