package com.github.motionfsm;

/**
 * Sink for the machine's log lines. Every line arrives already prefixed with a
 * {@code [HH:mm:ss.SSS]} timestamp.
 */
@FunctionalInterface
public interface LogCallback {

  void log(String message);

}
