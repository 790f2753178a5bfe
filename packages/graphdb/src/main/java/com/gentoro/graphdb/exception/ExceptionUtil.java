package com.gentoro.graphdb.exception;

import java.time.Instant;
import java.util.Arrays;
import java.util.stream.Collectors;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging. If the throwable is a
   * {@link GraphDbException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof GraphDbException ex) {
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
        GraphDbErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /**
   * One-line stack summary, top frame first, frames joined with {@code " > "}.
   *
   * @param maxFrames frames to keep; zero or less keeps all
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] frames = t.getStackTrace();
    return Arrays.stream(frames)
        .limit(maxFrames <= 0 ? frames.length : maxFrames)
        .map(ExceptionUtil::frame)
        .collect(Collectors.joining(" > "));
  }

  /** Walks the cause chain and returns the deepest non-blank message, or the type name. */
  public static String rootCauseMessage(Throwable t) {
    if (t == null) return "Unknown error";
    String message = null;
    for (Throwable current = t; current != null; current = current.getCause()) {
      if (current.getMessage() != null && !current.getMessage().isBlank()) {
        message = current.getMessage();
      }
      if (current.getCause() == current) break;
    }
    return message != null ? message : t.getClass().getSimpleName();
  }

  private static String frame(StackTraceElement e) {
    String file = e.getFileName() == null ? "Unknown Source" : e.getFileName();
    String line = e.getLineNumber() >= 0 ? ":" + e.getLineNumber() : "";
    return e.getClassName() + "." + e.getMethodName() + " (" + file + line + ")";
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
