package com.sysmlgraph.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends SysmlGraphException {
  public ConfigException(String message) {
    super(SysmlGraphErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(SysmlGraphErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
