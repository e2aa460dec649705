package com.github.motionfsm;

/**
 * This object encapsulates the outcome of dispatching one {@link SystemEvent} to a
 * {@link StateMachine}.
 * 
 * Successes report {@link #isSuccessful()} as true and carry {@link Outcome#COMMITTED}. Failures
 * carry the reason as an {@link Outcome}. Whenever a callback threw, successful or not, the
 * result holds the associated {@link #getError()}. {@link #getDescription()} mirrors the line written to the log.
 * 
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class TransitionResult {
  private final Outcome outcome;
  private final SystemEvent event;
  private final SystemState fromState;
  private final SystemState toState;
  private final String description;
  private final StateMachineException error;

  TransitionResult(final Outcome outcome, final SystemEvent event, final SystemState fromState,
      final SystemState toState, final String description, final StateMachineException error) {
    this.outcome = outcome;
    this.event = event;
    this.fromState = fromState;
    this.toState = toState;
    this.description = description;
    this.error = error;
  }

  /**
   * A committed result may still carry the error of a state change callback that threw after the
   * commit.
   */
  static TransitionResult committed(final SystemEvent event, final SystemState fromState,
      final SystemState toState, final String description, final StateMachineException error) {
    return new TransitionResult(Outcome.COMMITTED, event, fromState, toState, description, error);
  }

  static TransitionResult failed(final Outcome outcome, final SystemEvent event,
      final SystemState fromState, final SystemState toState, final String description) {
    return new TransitionResult(outcome, event, fromState, toState, description, null);
  }

  static TransitionResult failed(final Outcome outcome, final SystemEvent event,
      final SystemState fromState, final SystemState toState, final String description,
      final StateMachineException error) {
    return new TransitionResult(outcome, event, fromState, toState, description, error);
  }

  public boolean isSuccessful() {
    return outcome == Outcome.COMMITTED;
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public SystemEvent getEvent() {
    return event;
  }

  public SystemState getFromState() {
    return fromState;
  }

  /**
   * The target state; null when the event had no edge from {@link #getFromState()}.
   */
  public SystemState getToState() {
    return toState;
  }

  public String getDescription() {
    return description;
  }

  public StateMachineException getError() {
    return error;
  }

  @Override
  public String toString() {
    return "TransitionResult [outcome=" + outcome + ", event=" + event + ", fromState=" + fromState
        + ", toState=" + toState + ", description=" + description + ", error=" + error + "]";
  }

  public static enum Outcome {
    // the machine moved to toState
    COMMITTED,
    // no edge for this event in fromState
    REJECTED,
    // the event callback returned false
    CALLBACK_VETOED,
    // the event callback threw
    CALLBACK_FAILED,
    // the edge vanished between lookup and commit
    INVALID_TRANSITION,
    // a callback tried to dispatch into the machine that is invoking it
    REENTRANT_CALL;
  }
}
