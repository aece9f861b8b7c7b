package com.sysmlgraph.exception;

import java.time.Clock;
import java.time.Instant;
import java.util.function.Function;

/** Helpers for turning exceptions into structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. If the throwable is a {@link
   * SysmlGraphException}, its code and context are preserved; anything else maps to {@link
   * SysmlGraphErrorCode#UNKNOWN}.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    return toErrorDetails(t, Clock.systemUTC());
  }

  public static ErrorDetails toErrorDetails(Throwable t, Clock clock) {
    Instant now = Instant.now(clock);
    if (t instanceof SysmlGraphException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          now);
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(), safeMessage(t.getMessage()), SysmlGraphErrorCode.UNKNOWN, null, now);
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  /** Return {@code t} when it already is a {@link SysmlGraphException}, otherwise wrap it. */
  public static SysmlGraphException rethrowIfUnchecked(
      Throwable t, Function<Throwable, SysmlGraphException> wrapper) {
    if (t instanceof SysmlGraphException ex) {
      return ex;
    }
    return wrapper.apply(t);
  }
}
