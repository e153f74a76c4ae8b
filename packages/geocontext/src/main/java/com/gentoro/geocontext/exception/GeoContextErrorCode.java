package com.gentoro.geocontext.exception;

/**
 * Canonical error codes for GeoContext. Codes are stable and suitable for logs and callers that
 * need to branch on the failure origin without parsing messages.
 */
public enum GeoContextErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  DEADLINE_EXCEEDED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  CREATION_ERROR,
  FILTER_ERROR,
}
