package com.turn.peerwire;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

public class Utils {

  private final static String LOG_PROPERTY_KEY = "com.turn.peerwire.logLevel";

  public static Level getLogLevel() {
    final String levelStr = System.getProperty(LOG_PROPERTY_KEY);
    return Level.toLevel(levelStr, Level.INFO);
  }

  public static void configureLogging() {
    Logger root = Logger.getRootLogger();
    if (!root.getAllAppenders().hasMoreElements()) {
      BasicConfigurator.configure(new ConsoleAppender(new PatternLayout("%d [%-25t] %-5p: %m%n")));
    }
    root.setLevel(getLogLevel());
  }
}
