package io.github.panghy.flowsim.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logging helpers for the simulation runtime.
 * Messages go through JUL (java.util.logging) with the real caller recorded as the
 * source class and method, so log output points at the runtime code and not at this
 * class.
 */
public final class LoggingUtil {

  private LoggingUtil() {
  }

  private static StackTraceElement getCaller() {
    StackTraceElement[] stack = Thread.currentThread().getStackTrace();
    // 0=getStackTrace, 1=getCaller, 2=log, 3=debug/info/...
    for (int i = 3; i < stack.length; i++) {
      StackTraceElement element = stack[i];
      if (!element.getClassName().equals(LoggingUtil.class.getName())) {
        return element;
      }
    }
    return stack[stack.length - 1];
  }

  private static void log(Logger logger, Level level, String message, Throwable throwable) {
    if (!logger.isLoggable(level)) {
      return;
    }
    StackTraceElement caller = getCaller();
    if (throwable == null) {
      logger.logp(level, caller.getClassName(), caller.getMethodName(), message);
    } else {
      logger.logp(level, caller.getClassName(), caller.getMethodName(), message, throwable);
    }
  }

  /**
   * Logs at FINE. Used for the per-event simulation trace.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void debug(Logger logger, String message) {
    log(logger, Level.FINE, message, null);
  }

  public static void info(Logger logger, String message) {
    log(logger, Level.INFO, message, null);
  }

  public static void warn(Logger logger, String message) {
    log(logger, Level.WARNING, message, null);
  }

  /**
   * Logs at WARNING with the stack trace of {@code throwable}.
   *
   * @param logger    The logger to use
   * @param message   The message to log
   * @param throwable The exception to log
   */
  public static void warn(Logger logger, String message, Throwable throwable) {
    log(logger, Level.WARNING, message, throwable);
  }

  public static void error(Logger logger, String message) {
    log(logger, Level.SEVERE, message, null);
  }

  public static void error(Logger logger, String message, Throwable throwable) {
    log(logger, Level.SEVERE, message, throwable);
  }
}
