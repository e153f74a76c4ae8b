package com.gentoro.geocontext.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends GeoContextException {
  public ValidationException(String message) {
    super(GeoContextErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(GeoContextErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
