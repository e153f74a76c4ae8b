package com.gentoro.geocontext.exception;

/** Failure while reading or writing JSON/YAML content. */
public class SerializationException extends GeoContextException {
  public SerializationException(String message) {
    super(GeoContextErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(GeoContextErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
