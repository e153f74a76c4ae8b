package com.gentoro.geocontext.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends GeoContextException {
  public StateException(String message) {
    super(GeoContextErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(GeoContextErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
