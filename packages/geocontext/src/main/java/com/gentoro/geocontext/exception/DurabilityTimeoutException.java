package com.gentoro.geocontext.exception;

import java.time.Duration;
import java.util.Map;

/**
 * Raised when a flushed batch still holds unconfirmed writes after the configured durability
 * timeout elapsed.
 */
public class DurabilityTimeoutException extends GeoContextException {
  private final int unconfirmed;

  public DurabilityTimeoutException(int unconfirmed, Duration timeout) {
    super(
        GeoContextErrorCode.DEADLINE_EXCEEDED,
        "%d write(s) not confirmed durable within %d ms"
            .formatted(unconfirmed, timeout.toMillis()),
        Map.of("unconfirmed", unconfirmed, "timeoutMs", timeout.toMillis()));
    this.unconfirmed = unconfirmed;
  }

  /** Number of writes still pending when the deadline was reached. */
  public int getUnconfirmed() {
    return unconfirmed;
  }
}
