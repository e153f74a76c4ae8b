package com.gentoro.geocontext.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends GeoContextException {
  public ConfigException(String message) {
    super(GeoContextErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(GeoContextErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
