package com.github.motionfsm;

/**
 * Unified single exception for this FSM. The code enum encapsulates the various error conditions.
 * 
 * Runtime operations never throw it: event dispatch reports failures through boolean returns and
 * log lines, and only hands an instance over as the {@link TransitionResult#getError()} of a
 * failed dispatch. It is thrown when a {@link StateMachineConfiguration} fails validation.
 */
public final class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StateMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StateMachineException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_MACHINE_CONFIG("State machine configuration is invalid"),
    // 2.
    EVENT_CALLBACK_FAILURE(
        "Event callback threw while gating a transition. The transition was not committed."),
    // 3.
    STATE_CHANGE_CALLBACK_FAILURE(
        "State change callback threw after a transition was committed. The transition stands.");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
