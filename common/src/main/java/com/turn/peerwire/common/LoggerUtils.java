package com.turn.peerwire.common;

import org.slf4j.Logger;

public final class LoggerUtils {

  private LoggerUtils() {
  }

  public static void warnAndDebugDetails(Logger logger, String message, Throwable t) {
    logger.warn(message);
    logger.debug("", t);
  }

  public static void warnAndDebugDetails(Logger logger, String message, Object arg, Throwable t) {
    logger.warn(message, arg);
    logger.debug("", t);
  }

  public static void errorAndDebugDetails(Logger logger, String message, Object arg, Throwable t) {
    logger.error(message, arg);
    logger.debug("", t);
  }

  public static void debugWithDetails(Logger logger, String message, Object arg, Throwable t) {
    logger.debug(message + ": " + describe(t), arg);
    logger.trace("", t);
  }

  /**
   * Short one-line description of a failure, for log lines that carry the
   * stack trace only at debug level.
   */
  public static String describe(Throwable t) {
    return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
  }

}
