package com.sysmlgraph.exception;

import java.util.Map;

/** Illegal or unexpected state encountered. */
public class StateException extends SysmlGraphException {
  public StateException(String message) {
    super(SysmlGraphErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(SysmlGraphErrorCode.FAILED_PRECONDITION, message, cause);
  }

  public StateException(String message, Map<String, ?> context) {
    super(SysmlGraphErrorCode.FAILED_PRECONDITION, message, context);
  }
}
