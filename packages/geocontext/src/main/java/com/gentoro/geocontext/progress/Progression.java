package com.gentoro.geocontext.progress;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Percentage of a generation run, between 0 and 100.
 *
 * <p>The value never decreases: lower values passed to {@link #set} are ignored and values above
 * 100 are clamped. Every change is forwarded to a {@link ProgressSink} as a step of the
 * "generate" stage, with the rounded percentage as completed work out of 100.
 */
public final class Progression {
  public static final String STAGE = "generate";
  public static final double MAX = 100.0;

  private final ProgressSink sink;
  private double value;

  public Progression() {
    this(new NoOpProgressSink());
  }

  public Progression(ProgressSink sink) {
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  public synchronized double value() {
    return value;
  }

  public synchronized void set(double newValue) {
    double clamped = Math.min(MAX, newValue);
    if (Double.isNaN(clamped) || clamped <= value) {
      return;
    }
    value = clamped;
    sink.step(STAGE, Math.round(value), "progress " + Math.round(value) + "%", Map.of());
  }

  public synchronized void advance(double delta) {
    if (delta > 0) {
      set(value + delta);
    }
  }

  public void begin(String label) {
    sink.beginStage(STAGE, label, (long) MAX);
  }

  public void complete(Map<String, Object> attrs) {
    set(MAX);
    sink.endStageOk(STAGE, attrs);
  }

  public void fail(String errorSummary) {
    fail(errorSummary, Map.of());
  }

  /** Ends the stage in error; {@code attrs} are reported along with the reached percentage. */
  public void fail(String errorSummary, Map<String, Object> attrs) {
    Map<String, Object> reported = new LinkedHashMap<>(attrs);
    reported.put("percent", Math.round(value()));
    sink.endStageError(STAGE, errorSummary, reported);
  }
}
