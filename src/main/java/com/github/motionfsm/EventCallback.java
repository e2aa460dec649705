package com.github.motionfsm;

/**
 * Gate consulted before a transition on a particular {@link SystemEvent} is committed. Returning
 * false, or throwing, leaves the machine where it was.
 * 
 * The callback runs while the machine holds its lock (when thread-safety is on). It may read the
 * machine but must not fire events into it or reset it; such calls are refused.
 */
@FunctionalInterface
public interface EventCallback {

  boolean onEvent(SystemEvent event);

  /**
   * Called by the machine with the payload handed to
   * {@link StateMachine#triggerEvent(SystemEvent, String)}, or an empty string. Override this to
   * inspect the payload; the default ignores it.
   */
  default boolean onEvent(SystemEvent event, String data) {
    return onEvent(event);
  }

}
