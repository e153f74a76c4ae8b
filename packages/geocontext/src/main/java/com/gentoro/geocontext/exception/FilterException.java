package com.gentoro.geocontext.exception;

/** The item filter could not decide which references qualify. */
public class FilterException extends GeoContextException {
  public FilterException(String message) {
    super(GeoContextErrorCode.FILTER_ERROR, message);
  }

  public FilterException(String message, Throwable cause) {
    super(GeoContextErrorCode.FILTER_ERROR, message, cause);
  }
}
