package com.gentoro.geocontext.exception;

/** A graph node referenced by a lookup does not exist (anymore). */
public class NotFoundException extends GeoContextException {
  public NotFoundException(String message) {
    super(GeoContextErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(GeoContextErrorCode.NOT_FOUND, message, cause);
  }

  public NotFoundException(String message, java.util.Map<String, ?> context) {
    super(GeoContextErrorCode.NOT_FOUND, message, context);
  }
}
