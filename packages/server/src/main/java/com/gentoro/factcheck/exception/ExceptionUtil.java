package com.gentoro.factcheck.exception;

import java.time.Instant;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. If the throwable is a {@link
   * FactCheckException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof FactCheckException ex) {
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
        FactCheckErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /** Innermost non-empty message of the cause chain, falling back to the type name. */
  public static String rootMessage(Throwable t) {
    String message = null;
    Throwable current = t;
    while (current != null) {
      if (current.getMessage() != null && !current.getMessage().isBlank()) {
        message = current.getMessage();
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return message != null ? message : (t == null ? "" : t.getClass().getSimpleName());
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static FactCheckException rethrowIfUnchecked(
      Throwable t, Function<Throwable, FactCheckException> supplier) {
    if (t instanceof FactCheckException) {
      return (FactCheckException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
