package com.sysmlgraph.mapping;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.sysmlgraph.spec.ElementSpec;
import java.util.List;

/** Decoded spec plus the fields that had to be skipped. */
public record DecodeResult(ElementSpec spec, List<DecodeIssue> issues) {

  public DecodeResult {
    issues = List.copyOf(issues);
  }

  @JsonIgnore
  public boolean isClean() {
    return issues.isEmpty();
  }
}
