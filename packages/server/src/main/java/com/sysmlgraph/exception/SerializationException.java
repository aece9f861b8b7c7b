package com.sysmlgraph.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends SysmlGraphException {
  public SerializationException(String message) {
    super(SysmlGraphErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(SysmlGraphErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
