package com.gentoro.kgraph.exception;

import java.time.Instant;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or API responses. If the
   * throwable is a {@link KnowledgeGraphException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof KnowledgeGraphException ex) {
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
        KnowledgeGraphErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /** Whether a caller may retry the failed operation as-is. Only store failures qualify. */
  public static boolean isRetryable(Throwable t) {
    return t instanceof KnowledgeGraphException ex
        && ex.getCode() == KnowledgeGraphErrorCode.STORE_ERROR;
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
