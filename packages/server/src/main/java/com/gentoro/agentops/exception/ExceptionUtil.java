package com.gentoro.agentops.exception;

import java.time.Instant;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. If the throwable is an {@link
   * AgentOpsException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof AgentOpsException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext().isEmpty() ? null : ex.getContext(),
          Instant.now().toString());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        AgentOpsErrorCode.UNKNOWN,
        null,
        Instant.now().toString());
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, frames joined in
   * call order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
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

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Human readable one-liner: the exception's simple name and message, followed by the root
   * cause's when it differs. Used wherever an error ends up as conversation text.
   */
  public static String describe(Throwable t) {
    if (t == null) return "";
    Throwable root = t;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    String head = t.getClass().getSimpleName() + ": " + safeMessage(t.getMessage());
    if (root == t) return head;
    return head + " (caused by " + root.getClass().getSimpleName() + ": "
        + safeMessage(root.getMessage()) + ")";
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static AgentOpsException rethrowIfUnchecked(
      Throwable t, Function<Throwable, AgentOpsException> supplier) {
    if (t instanceof AgentOpsException) {
      return (AgentOpsException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
