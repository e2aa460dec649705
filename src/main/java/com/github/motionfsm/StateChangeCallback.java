package com.github.motionfsm;

/**
 * Notified after a transition has been committed. It cannot veto; if it throws, the error is
 * logged and the new state stands.
 */
@FunctionalInterface
public interface StateChangeCallback {

  void onStateChange(SystemState oldState, SystemState newState);

}
