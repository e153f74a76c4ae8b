package com.gentoro.geocontext.progress;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.geocontext.logging.LoggingService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LoggingProgressSinkTest {

  /** Captures payloads instead of only logging them. */
  private static final class CapturingSink extends LoggingProgressSink {
    private final List<Map<String, Object>> payloads = new ArrayList<>();

    CapturingSink(long minIntervalMs, long minDelta) {
      super(LoggingService.getLogger(LoggingProgressSinkTest.class), minIntervalMs, minDelta);
    }

    @Override
    void emit(
        String id,
        String label,
        long completed,
        long total,
        String message,
        Map<String, Object> attrs,
        String status) {
      payloads.add(createPayload(id, label, completed, total, message, attrs, status));
      super.emit(id, label, completed, total, message, attrs, status);
    }
  }

  @Test
  void stageLifecycleProducesStablePayloads() {
    CapturingSink sink = new CapturingSink(0, 0);

    sink.beginStage("generate", "Generating context BuildingContext", 100);
    sink.step("generate", 40, "progress 40%", Map.of());
    sink.endStageOk("generate", Map.of("writes", 9));

    assertEquals(3, sink.payloads.size());
    assertEquals("running", sink.payloads.get(0).get("status"));
    assertEquals(40, sink.payloads.get(1).get("percent"));
    assertEquals("Generating context BuildingContext", sink.payloads.get(1).get("label"));
    Map<String, Object> end = sink.payloads.get(2);
    assertEquals("ok", end.get("status"));
    assertEquals(100L, end.get("completed"));
    assertEquals(Map.of("writes", 9), end.get("attrs"));
  }

  @Test
  void stepsAreRateLimited() {
    CapturingSink sink = new CapturingSink(60_000, 10);
    sink.beginStage("generate", "label", 100);

    sink.step("generate", 10, "a", Map.of());
    sink.step("generate", 12, "b", Map.of());
    sink.step("generate", 30, "c", Map.of());

    assertEquals(
        List.of("begin", "a", "c"), sink.payloads.stream().map(p -> p.get("message")).toList());
  }

  @Test
  void errorCarriesSummary() {
    CapturingSink sink = new CapturingSink(0, 0);
    sink.beginStage("generate", "label", 100);

    sink.endStageError("generate", "Node ctx-1 does not exist", Map.of());

    Map<String, Object> payload = sink.payloads.get(1);
    assertEquals("error", payload.get("status"));
    assertEquals(
        "Node ctx-1 does not exist", ((Map<?, ?>) payload.get("attrs")).get("error"));
  }

  @Test
  void payloadClampsCompletedAndPercent() {
    CapturingSink sink = new CapturingSink(0, 0);

    Map<String, Object> over = sink.createPayload("s", "l", 150, 100, "m", null, "running");
    Map<String, Object> unknownTotal = sink.createPayload("s", "l", 5, 0, "m", null, "running");

    assertEquals(100L, over.get("completed"));
    assertEquals(100, over.get("percent"));
    assertEquals(0, unknownTotal.get("percent"));
  }
}
