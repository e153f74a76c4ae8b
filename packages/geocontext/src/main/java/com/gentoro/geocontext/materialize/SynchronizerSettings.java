package com.gentoro.geocontext.materialize;

import com.gentoro.geocontext.exception.ConfigException;
import java.time.Duration;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Flow control of the {@link WriteSynchronizer}.
 *
 * @param batchSize maximum number of unconfirmed writes held before a flush
 * @param pollInterval delay between two durability checks of a flushed batch
 * @param durabilityTimeout how long one flush may wait in total; {@link Duration#ZERO} waits
 *     forever
 */
public record SynchronizerSettings(
    int batchSize, Duration pollInterval, Duration durabilityTimeout) {
  public static final int DEFAULT_BATCH_SIZE = 300;
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);
  public static final Duration DEFAULT_DURABILITY_TIMEOUT = Duration.ofMinutes(2);

  public SynchronizerSettings {
    Objects.requireNonNull(pollInterval, "pollInterval");
    Objects.requireNonNull(durabilityTimeout, "durabilityTimeout");
    if (batchSize < 1) {
      throw new ConfigException("batchSize must be at least 1, got " + batchSize);
    }
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new ConfigException("pollInterval must be positive, got " + pollInterval);
    }
    if (durabilityTimeout.isNegative()) {
      throw new ConfigException("durabilityTimeout must not be negative");
    }
  }

  public static SynchronizerSettings defaults() {
    return new SynchronizerSettings(
        DEFAULT_BATCH_SIZE, DEFAULT_POLL_INTERVAL, DEFAULT_DURABILITY_TIMEOUT);
  }

  /** Read {@code geocontext.synchronizer.*}, falling back to the defaults. */
  public static SynchronizerSettings fromConfiguration(Configuration config) {
    return new SynchronizerSettings(
        config.getInt("geocontext.synchronizer.batchSize", DEFAULT_BATCH_SIZE),
        Duration.ofMillis(
            config.getLong(
                "geocontext.synchronizer.pollIntervalMs", DEFAULT_POLL_INTERVAL.toMillis())),
        Duration.ofMillis(
            config.getLong(
                "geocontext.synchronizer.durabilityTimeoutMs",
                DEFAULT_DURABILITY_TIMEOUT.toMillis())));
  }

  public boolean waitsForever() {
    return durabilityTimeout.isZero();
  }
}
