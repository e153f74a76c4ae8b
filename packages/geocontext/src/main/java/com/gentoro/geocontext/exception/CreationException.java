package com.gentoro.geocontext.exception;

/** The graph store rejected a create or attach call. */
public class CreationException extends GeoContextException {
  public CreationException(String message) {
    super(GeoContextErrorCode.CREATION_ERROR, message);
  }

  public CreationException(String message, Throwable cause) {
    super(GeoContextErrorCode.CREATION_ERROR, message, cause);
  }

  public CreationException(String message, java.util.Map<String, ?> context, Throwable cause) {
    super(GeoContextErrorCode.CREATION_ERROR, message, context, cause);
  }
}
