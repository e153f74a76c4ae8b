package com.gentoro.geocontext.materialize;

import com.gentoro.geocontext.exception.CreationException;
import com.gentoro.geocontext.exception.DurabilityTimeoutException;
import com.gentoro.geocontext.exception.ExceptionUtil;
import com.gentoro.geocontext.exception.StateException;
import com.gentoro.geocontext.graph.PendingWrite;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drains a sequence of {@link PendingWrite}s while keeping at most {@code batchSize} of them
 * unconfirmed.
 *
 * <p>Writes are pulled into a batch. A full batch is flushed before anything else is pulled:
 * first every write must have been issued, then the batch is polled until each write reports
 * itself durable. The remainder of the sequence is flushed the same way once it is exhausted.
 * Because batches are flushed in pull order, a write is always confirmed before any write pulled
 * after its batch is issued.
 */
public class WriteSynchronizer {
  private static final org.slf4j.Logger log =
      com.gentoro.geocontext.logging.LoggingService.getLogger(WriteSynchronizer.class);

  private final SynchronizerSettings settings;

  public WriteSynchronizer(SynchronizerSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public SynchronizerSettings settings() {
    return settings;
  }

  /**
   * Pull every write from {@code writes} and wait until all of them are durable.
   *
   * @throws CreationException when the store rejected one of the writes
   * @throws DurabilityTimeoutException when a batch is not confirmed in time
   * @throws StateException when the calling thread is interrupted while waiting
   */
  public SynchronizationReport drain(Iterator<PendingWrite> writes, FlushListener listener) {
    FlushListener onFlush = listener == null ? FlushListener.NONE : listener;
    List<PendingWrite> batch = new ArrayList<>(settings.batchSize());
    int total = 0;
    int flushes = 0;

    while (writes.hasNext()) {
      batch.add(writes.next());
      total++;
      if (batch.size() == settings.batchSize()) {
        flush(batch);
        flushes++;
        onFlush.onFlush(settings.batchSize(), false);
      }
    }
    if (!batch.isEmpty()) {
      int size = batch.size();
      flush(batch);
      flushes++;
      onFlush.onFlush(size, true);
    }
    return new SynchronizationReport(total, flushes);
  }

  /** Wait for issuance, then for durability, of every write of {@code batch}; empties it. */
  void flush(List<PendingWrite> batch) {
    long started = System.nanoTime();
    long deadline = settings.waitsForever() ? Long.MAX_VALUE : started + timeoutNanos();
    int size = batch.size();

    awaitIssued(batch, deadline);

    while (true) {
      batch.removeIf(PendingWrite::isDurable);
      if (batch.isEmpty()) {
        break;
      }
      long remaining =
          settings.waitsForever() ? Long.MAX_VALUE : deadline - System.nanoTime();
      if (remaining <= 0) {
        log.warn(
            "{} of {} write(s) still unconfirmed after {} ms, first: {}",
            batch.size(),
            size,
            settings.durabilityTimeout().toMillis(),
            batch.get(0));
        throw new DurabilityTimeoutException(batch.size(), settings.durabilityTimeout());
      }
      sleep(Math.min(settings.pollInterval().toNanos(), remaining));
    }
    log.debug(
        "Flushed {} write(s) in {} ms",
        size,
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
  }

  private void awaitIssued(List<PendingWrite> batch, long deadline) {
    CompletableFuture<?>[] issued =
        batch.stream().map(PendingWrite::issued).toArray(CompletableFuture[]::new);
    try {
      CompletableFuture<Void> all = CompletableFuture.allOf(issued);
      if (settings.waitsForever()) {
        all.get();
      } else {
        all.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
      }
    } catch (ExecutionException e) {
      throw firstFailure(batch, e);
    } catch (TimeoutException e) {
      long notIssued = batch.stream().filter(w -> !w.issued().isDone()).count();
      throw new DurabilityTimeoutException((int) notIssued, settings.durabilityTimeout());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StateException("Interrupted while waiting for writes to be issued", e);
    }
  }

  private RuntimeException firstFailure(List<PendingWrite> batch, ExecutionException e) {
    for (PendingWrite write : batch) {
      if (write.issued().isCompletedExceptionally()) {
        try {
          write.issued().join();
        } catch (RuntimeException failure) {
          Throwable cause = ExceptionUtil.unwrap(failure);
          log.error("Write {} was rejected by the store", write, cause);
          return ExceptionUtil.rethrowIfUnchecked(
              cause,
              t ->
                  new CreationException(
                      "Write " + write.writeId() + " failed",
                      Map.of("write", write.writeId(), "subject", write.subject()),
                      t));
        }
      }
    }
    Throwable cause = ExceptionUtil.unwrap(e);
    return ExceptionUtil.rethrowIfUnchecked(
        cause, t -> new CreationException("A write of the batch failed", t));
  }

  private static void sleep(long nanos) {
    try {
      TimeUnit.NANOSECONDS.sleep(nanos);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StateException("Interrupted while waiting for writes to become durable", e);
    }
  }

  private long timeoutNanos() {
    try {
      return settings.durabilityTimeout().toNanos();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE / 2;
    }
  }
}
