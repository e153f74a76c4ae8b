package com.gentoro.geocontext.exception;

import java.time.Instant;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. Future wrappers are stripped first;
   * a {@link GeoContextException} keeps its code and context.
   */
  public static ErrorDetails toErrorDetails(Throwable error) {
    Throwable t = unwrap(error);
    if (t instanceof GeoContextException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        GeoContextErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /**
   * Strip the wrappers added by {@link java.util.concurrent.CompletableFuture} so callers see the
   * exception the store actually raised.
   */
  public static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Return {@code t} itself when it already is a {@link GeoContextException}, otherwise wrap it
   * with {@code supplier}.
   */
  public static GeoContextException rethrowIfUnchecked(
      Throwable t, Function<Throwable, GeoContextException> supplier) {
    if (t instanceof GeoContextException ex) {
      return ex;
    }
    return supplier.apply(t);
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
