package com.sysmlgraph.exception;

import java.util.Map;

/** Input validation failure or illegal argument. */
public class ValidationException extends SysmlGraphException {
  public ValidationException(String message) {
    super(SysmlGraphErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(SysmlGraphErrorCode.INVALID_ARGUMENT, message, cause);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(SysmlGraphErrorCode.INVALID_ARGUMENT, message, context);
  }
}
