package com.github.motionfsm;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default {@link LogCallback}. Writes {@code [tag] line} at INFO to a Log4j logger named after the
 * tag, which the console appender of a typical Log4j configuration prints to stdout.
 */
public final class Log4jLogCallback implements LogCallback {
  private final Logger logger;
  private final String prefix;

  public Log4jLogCallback(final String tag) {
    this.logger = LogManager.getLogger(tag);
    this.prefix = "[" + tag + "] ";
  }

  @Override
  public void log(final String message) {
    logger.info(prefix + message);
  }

  @Override
  public String toString() {
    return "Log4jLogCallback [logger=" + logger.getName() + "]";
  }
}
