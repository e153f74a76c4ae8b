package com.gentoro.geocontext.materialize;

/** Notified after each batch has been confirmed durable. */
@FunctionalInterface
public interface FlushListener {
  FlushListener NONE = (size, partial) -> {};

  /**
   * @param size number of writes in the confirmed batch
   * @param partial true for the final batch that was smaller than the batch size
   */
  void onFlush(int size, boolean partial);
}
