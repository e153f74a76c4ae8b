package com.gentoro.geocontext.graph;

import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * Handle on a create or attach call that has been issued to a {@link GraphStore} but is not
 * necessarily durable yet.
 *
 * <p>Two signals are exposed separately: {@link #issued()} completes when the store call itself
 * returned (exceptionally when the store rejected it), while {@link #isDurable()} turns true once
 * the store confirmed the write is persisted. A store that persists synchronously reports both at
 * the same time.
 */
public interface PendingWrite {

  /** Store-unique identifier of this write. */
  String writeId();

  WriteKind kind();

  /** Name of the created node or of the attached item. */
  String subject();

  CompletableFuture<Void> issued();

  boolean isDurable();

  static PendingWrite of(
      String writeId,
      WriteKind kind,
      String subject,
      CompletableFuture<Void> issued,
      BooleanSupplier durable) {
    return new Handle(writeId, kind, subject, issued, durable);
  }

  record Handle(
      String writeId,
      WriteKind kind,
      String subject,
      CompletableFuture<Void> issued,
      BooleanSupplier durable)
      implements PendingWrite {

    @Override
    public boolean isDurable() {
      return durable.getAsBoolean();
    }

    @Override
    public String toString() {
      return "PendingWrite{" + writeId + ", " + kind + " '" + subject + "'}";
    }
  }
}
