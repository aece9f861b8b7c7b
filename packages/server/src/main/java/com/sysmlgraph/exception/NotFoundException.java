package com.sysmlgraph.exception;

import java.util.Map;

/** Element, relationship or diagram requested was not found. */
public class NotFoundException extends SysmlGraphException {
  public NotFoundException(String message) {
    super(SysmlGraphErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(SysmlGraphErrorCode.NOT_FOUND, message, cause);
  }

  public NotFoundException(String message, Map<String, ?> context) {
    super(SysmlGraphErrorCode.NOT_FOUND, message, context);
  }
}
