package com.sysmlgraph.mapping;

import com.fasterxml.jackson.annotation.JsonValue;

/** Whether a node kind declares a reusable type or an occurrence of one. */
public enum ElementKind {
  DEFINITION("definition"),
  USAGE("usage");

  private final String value;

  ElementKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
