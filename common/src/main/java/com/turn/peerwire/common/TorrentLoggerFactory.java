package com.turn.peerwire.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckForNull;

/**
 * Logger lookup for the whole library.
 *
 * <p>
 * Embedders that want every peerwire log line under a single category can
 * set a static logger name; otherwise loggers are named after their class.
 * </p>
 */
public final class TorrentLoggerFactory {

  @CheckForNull
  private static volatile String staticLoggersName = null;

  private TorrentLoggerFactory() {
  }

  public static Logger getLogger(Class<?> clazz) {
    String name = staticLoggersName;
    if (name == null) {
      name = clazz.getName();
    }
    return LoggerFactory.getLogger(name);
  }

  public static void setStaticLoggersName(@CheckForNull String staticLoggersName) {
    TorrentLoggerFactory.staticLoggersName = staticLoggersName;
  }
}
