package com.sysmlgraph.exception;

import java.util.Map;

/** An element, relationship or diagram with the same id already exists. */
public class AlreadyExistsException extends SysmlGraphException {
  public AlreadyExistsException(String message) {
    super(SysmlGraphErrorCode.ALREADY_EXISTS, message);
  }

  public AlreadyExistsException(String message, Throwable cause) {
    super(SysmlGraphErrorCode.ALREADY_EXISTS, message, cause);
  }

  public AlreadyExistsException(String message, Map<String, ?> context) {
    super(SysmlGraphErrorCode.ALREADY_EXISTS, message, context);
  }
}
