package com.gentoro.geocontext.exception;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured view of a failure, as reported alongside a failed generation run.
 *
 * @param type simple class name of the exception
 * @param message exception message, empty when it had none
 * @param code error code, {@link GeoContextErrorCode#UNKNOWN} for foreign exceptions
 * @param context context recorded by a {@link GeoContextException}, empty otherwise
 * @param timestamp when the failure was captured
 */
public record ErrorDetails(
    String type,
    String message,
    GeoContextErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {

  public ErrorDetails {
    context =
        context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  /** Flat attributes for progress and log events: {@code error}, {@code code} and the context. */
  public Map<String, Object> toAttributes() {
    Map<String, Object> attrs = new LinkedHashMap<>(context);
    attrs.put("error", type);
    attrs.put("code", code.name());
    attrs.put("timestamp", timestamp.toString());
    return attrs;
  }
}
