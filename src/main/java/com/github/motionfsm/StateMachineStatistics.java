package com.github.motionfsm;

/**
 * Point-in-time snapshot of the counters a {@link StateMachine} keeps about its own activity. The
 * machine copies its counters under its own guard, so a snapshot is internally consistent when
 * thread-safety is on.
 */
public final class StateMachineStatistics {
  private final String machineId;
  private final long startTstampMillis;
  private final long committedTransitions;
  private final long rejectedEvents;
  private final long vetoedEvents;
  private final long failedEventCallbacks;
  private final long stateChangeCallbackFaults;
  private final long resets;
  private final long lastTransitionMillis;

  StateMachineStatistics(final String machineId, final long startTstampMillis,
      final long committedTransitions, final long rejectedEvents, final long vetoedEvents,
      final long failedEventCallbacks, final long stateChangeCallbackFaults, final long resets,
      final long lastTransitionMillis) {
    this.machineId = machineId;
    this.startTstampMillis = startTstampMillis;
    this.committedTransitions = committedTransitions;
    this.rejectedEvents = rejectedEvents;
    this.vetoedEvents = vetoedEvents;
    this.failedEventCallbacks = failedEventCallbacks;
    this.stateChangeCallbackFaults = stateChangeCallbackFaults;
    this.resets = resets;
    this.lastTransitionMillis = lastTransitionMillis;
  }

  public String getMachineId() {
    return machineId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public long getCommittedTransitions() {
    return committedTransitions;
  }

  /**
   * Events that had no edge from the state they were fired in.
   */
  public long getRejectedEvents() {
    return rejectedEvents;
  }

  /**
   * Events whose callback returned false.
   */
  public long getVetoedEvents() {
    return vetoedEvents;
  }

  /**
   * Events whose callback threw.
   */
  public long getFailedEventCallbacks() {
    return failedEventCallbacks;
  }

  public long getStateChangeCallbackFaults() {
    return stateChangeCallbackFaults;
  }

  public long getResets() {
    return resets;
  }

  /**
   * Wall clock time of the last committed transition or reset, 0 if there was none.
   */
  public long getLastTransitionMillis() {
    return lastTransitionMillis;
  }

  @Override
  public String toString() {
    return "StateMachineStatistics [machineId=" + machineId + ", startTstampMillis="
        + startTstampMillis + ", committedTransitions=" + committedTransitions
        + ", rejectedEvents=" + rejectedEvents + ", vetoedEvents=" + vetoedEvents
        + ", failedEventCallbacks=" + failedEventCallbacks + ", stateChangeCallbackFaults="
        + stateChangeCallbackFaults + ", resets=" + resets + ", lastTransitionMillis="
        + lastTransitionMillis + "]";
  }

}
