package com.sysmlgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.sysmlgraph.exception.ValidationException;
import com.sysmlgraph.mapping.KindTranslator;
import java.util.Map;

/** Ownership flavor of a part usage: strong composition or shared aggregation. */
public enum CompositionType {
  COMPOSITION("composition"),
  AGGREGATION("aggregation");

  private final String edgeKind;

  CompositionType(String edgeKind) {
    this.edgeKind = edgeKind;
  }

  @JsonValue
  public String edgeKind() {
    return edgeKind;
  }

  public String relType() {
    return KindTranslator.edgeKindToRelType(edgeKind);
  }

  @JsonCreator
  public static CompositionType fromEdgeKind(String value) {
    for (CompositionType t : values()) {
      if (t.edgeKind.equals(value)) return t;
    }
    throw new ValidationException(
        "Composition type must be 'composition' or 'aggregation'",
        Map.of("compositionType", String.valueOf(value)));
  }
}
