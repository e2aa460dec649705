package com.github.motionfsm;

/**
 * This class encapsulates all the configuration parameters for the StateMachine. Use the
 * {@code StateMachineConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. threadSafe is only the initial setting. {@link StateMachine#enableThreadSafety(boolean)} can
 * flip it later, as long as no other thread is inside the machine at that moment.<br>
 * 2. fairLock only matters once thread-safety is on. Fair ordering is the default so that a
 * steady stream of events cannot starve a reader or a waiter.<br>
 * 3. logTag prefixes every line written by the default {@link Log4jLogCallback} and names the
 * Log4j logger it writes to.<br>
 */
public final class StateMachineConfiguration {
  final static int maxLogTagLength = 20;
  final static String defaultLogTag = "FSM";

  private final boolean threadSafe;
  private final boolean fairLock;
  private final String logTag;

  public boolean isThreadSafe() {
    return threadSafe;
  }

  public boolean isFairLock() {
    return fairLock;
  }

  public String getLogTag() {
    return logTag;
  }

  /**
   * Thread-safety off, fair locking, "FSM" tag.
   */
  public static StateMachineConfiguration defaults() {
    return new StateMachineConfiguration(false, true, defaultLogTag);
  }

  public final static class StateMachineConfigurationBuilder {
    private boolean threadSafe;
    private boolean fairLock = true;
    private String logTag = defaultLogTag;

    public static StateMachineConfigurationBuilder newBuilder() {
      return new StateMachineConfigurationBuilder();
    }

    public StateMachineConfigurationBuilder threadSafe(final boolean threadSafe) {
      this.threadSafe = threadSafe;
      return this;
    }

    public StateMachineConfigurationBuilder fairLock(final boolean fairLock) {
      this.fairLock = fairLock;
      return this;
    }

    public StateMachineConfigurationBuilder logTag(final String logTag) {
      this.logTag = logTag;
      return this;
    }

    public StateMachineConfiguration build() throws StateMachineException {
      final StateMachineConfiguration config = new StateMachineConfiguration(threadSafe, fairLock,
          logTag == null ? null : logTag.trim());
      config.validate();
      return config;
    }

    private StateMachineConfigurationBuilder() {}
  }

  private void validate() throws StateMachineException {
    StringBuilder messages = new StringBuilder();
    if (logTag == null || logTag.isEmpty()) {
      messages.append("LogTag cannot be null or blank. ");
    } else if (logTag.length() > maxLogTagLength) {
      messages.append("LogTag cannot be longer than " + maxLogTagLength + " characters. ");
    }
    if (messages.length() > 0) {
      throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "StateMachineConfiguration [threadSafe=" + threadSafe + ", fairLock=" + fairLock
        + ", logTag=" + logTag + "]";
  }

  private StateMachineConfiguration(final boolean threadSafe, final boolean fairLock,
      final String logTag) {
    this.threadSafe = threadSafe;
    this.fairLock = fairLock;
    this.logTag = logTag;
  }

}
