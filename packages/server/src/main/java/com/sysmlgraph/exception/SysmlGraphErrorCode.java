package com.sysmlgraph.exception;

/**
 * Stable error codes for the modeling back end. Codes are suitable for downstream services and
 * logs; prefer the most specific code that reflects the failure origin.
 */
public enum SysmlGraphErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  ALREADY_EXISTS,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,

  // Persistence
  GRAPH_STORE_ERROR,
}
