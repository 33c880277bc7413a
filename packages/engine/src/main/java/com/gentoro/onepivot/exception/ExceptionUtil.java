package com.gentoro.onepivot.exception;

import java.time.Instant;

/** Helpers for rendering exceptions in logs and result diagnostics. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. The code and context of a {@link
   * OnePivotException} are preserved; anything else maps to {@link OnePivotErrorCode#UNKNOWN}.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof OnePivotException ex) {
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
        OnePivotErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, joining the top
   * frames in call order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   * @return a single-line compact stack trace string
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a default of 5 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 5);
  }

  /**
   * Short human-readable description of a failure: the exception type followed by its message,
   * or just the type when there is no message.
   */
  public static String describe(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    String message = t.getMessage();
    if (message == null || message.isBlank()) {
      return t.getClass().getSimpleName();
    }
    return t.getClass().getSimpleName() + ": " + message;
  }
}
