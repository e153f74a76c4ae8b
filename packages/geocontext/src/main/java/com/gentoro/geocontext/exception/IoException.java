package com.gentoro.geocontext.exception;

/** Failure while talking to the underlying graph store or file system. */
public class IoException extends GeoContextException {
  public IoException(String message) {
    super(GeoContextErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(GeoContextErrorCode.IO_ERROR, message, cause);
  }
}
