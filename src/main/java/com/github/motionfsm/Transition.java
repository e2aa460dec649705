package com.github.motionfsm;

/**
 * One edge of the {@link TransitionTable}: firing {@link #getEvent()} while in
 * {@link #getFromState()} moves the machine to {@link #getToState()}.
 */
public final class Transition {
  private final SystemState fromState;
  private final SystemEvent event;
  private final SystemState toState;

  Transition(final SystemState fromState, final SystemEvent event, final SystemState toState) {
    if (fromState == null || event == null || toState == null) {
      throw new IllegalArgumentException(
          String.format("Transition cannot have null members: %s -(%s)-> %s", fromState, event,
              toState));
    }
    this.fromState = fromState;
    this.event = event;
    this.toState = toState;
  }

  public SystemState getFromState() {
    return fromState;
  }

  public SystemEvent getEvent() {
    return event;
  }

  public SystemState getToState() {
    return toState;
  }

  /**
   * Self-loops such as IDLE -(RESET_REQUEST)-> IDLE still count as transitions and still notify.
   */
  public boolean isSelfLoop() {
    return fromState == toState;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + fromState.hashCode();
    result = prime * result + event.hashCode();
    result = prime * result + toState.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    Transition other = (Transition) obj;
    return fromState == other.fromState && event == other.event && toState == other.toState;
  }

  @Override
  public String toString() {
    return "Transition [fromState=" + fromState + ", event=" + event + ", toState=" + toState + "]";
  }
}
