package com.gentoro.geocontext.progress;

import java.util.Map;

/**
 * Progress reporting abstraction for long-running generation runs.
 *
 * <p>Decouples the generator (producer of progress events) from whoever renders them (logs, a
 * host UI). Implementations are expected to be lightweight and non-blocking, and to apply their
 * own rate limiting.
 */
public interface ProgressSink {

  /**
   * Signal the beginning of a stage.
   *
   * @param id stable stage identifier, e.g. "generate"
   * @param label human-readable label for presentation
   * @param totalWork total work units (may be 0 when unknown)
   */
  void beginStage(String id, String label, long totalWork);

  /**
   * Report an incremental step within a stage.
   *
   * @param id stage identifier
   * @param completed completed work units so far (monotonic, between 0..totalWork)
   * @param message short message describing the current step
   * @param attrs optional structured attributes
   */
  void step(String id, long completed, String message, Map<String, Object> attrs);

  /** Mark a stage as successfully completed. */
  void endStageOk(String id, Map<String, Object> attrs);

  /** Mark a stage as failed with a short error summary. */
  void endStageError(String id, String errorSummary, Map<String, Object> attrs);
}
