package com.gentoro.geocontext.progress;

import com.gentoro.geocontext.utility.JacksonUtility;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Progress sink that emits structured JSON messages to the application logs, under the
 * "[generation.progress]" prefix. Step messages are rate-limited with {@link
 * ProgressRateLimiter}; stage begin/end are always emitted. Each message has a stable shape:
 *
 * <pre>
 * {
 *   "stageId": "generate",
 *   "label": "Generating context BuildingContext",
 *   "completed": 40,
 *   "total": 100,
 *   "percent": 40,
 *   "message": "flushed 300 write(s)",
 *   "attrs": { ... },
 *   "status": "running|ok|error"
 * }
 * </pre>
 */
public class LoggingProgressSink implements ProgressSink {
  private final org.slf4j.Logger log;
  private final ProgressRateLimiter limiter;

  private final Map<String, Long> totals = new HashMap<>();
  private final Map<String, Long> completions = new HashMap<>();
  private final Map<String, String> labels = new HashMap<>();

  public LoggingProgressSink(org.slf4j.Logger logger, long minIntervalMs, long minDelta) {
    this.log = Objects.requireNonNull(logger, "logger");
    this.limiter = new ProgressRateLimiter(minIntervalMs, minDelta);
  }

  @Override
  public synchronized void beginStage(String id, String label, long totalWork) {
    totals.put(id, Math.max(0, totalWork));
    completions.put(id, 0L);
    labels.put(id, label);
    emit(id, label, 0L, totalWork, "begin", Map.of(), "running");
  }

  @Override
  public synchronized void step(
      String id, long completed, String message, Map<String, Object> attrs) {
    if (limiter.tryAcquire(System.currentTimeMillis(), completed)) {
      completions.put(id, completed);
      emit(
          id,
          labels.getOrDefault(id, id),
          completed,
          totals.getOrDefault(id, 0L),
          message,
          attrs == null ? Map.of() : attrs,
          "running");
    }
  }

  @Override
  public synchronized void endStageOk(String id, Map<String, Object> attrs) {
    long total = totals.getOrDefault(id, completions.getOrDefault(id, 0L));
    long done = Math.max(total, completions.getOrDefault(id, total));
    emit(
        id,
        labels.getOrDefault(id, id),
        done,
        total,
        "end",
        attrs == null ? Map.of() : attrs,
        "ok");
  }

  @Override
  public synchronized void endStageError(
      String id, String errorSummary, Map<String, Object> attrs) {
    Map<String, Object> merged = new HashMap<>();
    if (attrs != null) merged.putAll(attrs);
    if (errorSummary != null) merged.put("error", errorSummary);
    long total = totals.getOrDefault(id, completions.getOrDefault(id, 0L));
    long done = completions.getOrDefault(id, 0L);
    emit(id, labels.getOrDefault(id, id), done, total, "error", merged, "error");
  }

  /** Build the payload map. Marked protected to facilitate unit testing via subclassing. */
  protected Map<String, Object> createPayload(
      String id,
      String label,
      long completed,
      long total,
      String message,
      Map<String, Object> attrs,
      String status) {
    long safeTotal = Math.max(0, total);
    long safeCompleted = Math.max(0, Math.min(completed, safeTotal == 0 ? completed : safeTotal));
    int percent =
        safeTotal > 0 ? (int) Math.min(100, Math.round((safeCompleted * 100.0) / safeTotal)) : 0;
    return Map.of(
        "stageId", id,
        "label", label,
        "completed", safeCompleted,
        "total", safeTotal,
        "percent", percent,
        "message", message,
        "attrs", attrs == null ? Map.of() : attrs,
        "status", status);
  }

  void emit(
      String id,
      String label,
      long completed,
      long total,
      String message,
      Map<String, Object> attrs,
      String status) {
    Map<String, Object> payload =
        createPayload(id, label, completed, total, message, attrs, status);
    log.info("[generation.progress] {}", JacksonUtility.toJson(payload));
  }
}
