package com.github.motionfsm;

/**
 * A finite state machine driving the lifecycle of a robotic motion pipeline: idle, bring up the
 * motion planner, plan, execute, and the obstacle and error detours in between.
 * 
 * Notes for users:<br>
 * 0a. correctness is the most important virtue of this fsm<br>
 * 0b. the boolean contract is the next: no operation throws, success and failure are told apart by
 * the return value and the reason goes to the log<br>
 * 
 * 1. the transition table is fixed at construction and never changes. See
 * {@link TransitionTable#motionPipeline()}<br>
 * 
 * 2. all work happens synchronously on the caller's thread. There is no background thread and no
 * automatic retry; re-firing a rejected event is the caller's business<br>
 * 
 * 3. an instance is NOT thread-safe until {@link #enableThreadSafety(boolean)} is called with true.
 * From then on every operation, queries included, runs under a single exclusive lock, callbacks
 * included. Flip the flag only while no other thread is using the machine<br>
 * 
 * 4. because callbacks run under that lock, a callback must not fire events into the machine that
 * invoked it. Such calls are refused rather than recursing<br>
 * 
 * 5. it is designed to not be singleton within a process, so, if there's a desire to have many
 * state machines, just create as many as needed<br>
 * 
 * 6. {@link #close()} shuts the machine down if that has not happened yet, releasing any thread
 * blocked in {@link #waitForState(SystemState, long)}. Use try-with-resources where the machine has
 * a scope<br>
 */
public interface StateMachine extends AutoCloseable {

  ///// Lifecycle /////
  /**
   * Put the machine in IDLE, clear the previous state and mark it running. Always returns true.
   */
  boolean initialize();

  /**
   * Mark the machine running and force it into IDLE without notifying the state change callback.
   */
  void start();

  /**
   * Same as {@code triggerEvent(SystemEvent.STOP_REQUEST)}.
   */
  void stop();

  /**
   * Force the machine into IDLE regardless of the table and notify the state change callback
   * exactly once.
   */
  void reset();

  /**
   * Mark the machine not running and release every thread blocked in waitForState.
   */
  void shutdown();

  /**
   * Check if the state machine is running.
   */
  boolean alive();

  /**
   * Shutdown the machine unless {@link #shutdown()} already ran since the last initialize/start.
   */
  @Override
  void close();


  ///// Events /////
  /**
   * Fire an event. Returns true iff the machine committed a transition.
   */
  boolean triggerEvent(final SystemEvent event);

  /**
   * Fire an event with an opaque payload. The machine does not interpret data, it only hands it
   * to the event callback as is, except that a null payload arrives there as an empty string.
   * Returns true iff the machine committed a transition.
   */
  boolean triggerEvent(final SystemEvent event, final String data);

  /**
   * Same dispatch as {@link #triggerEvent(SystemEvent, String)} but reports why it failed.
   */
  TransitionResult fireEvent(final SystemEvent event, final String data);


  ///// Introspection /////
  SystemState getCurrentState();

  SystemState getPreviousState();

  String getCurrentStateName();

  boolean isInState(final SystemState state);

  /**
   * True iff the table has an edge for this event out of the current state. Event callbacks are
   * not consulted.
   */
  boolean canTransition(final SystemEvent event);

  TransitionTable getTransitionTable();


  ///// Blocking /////
  /**
   * Same as {@code waitForState(target, 0)}, wait without a timeout.
   */
  boolean waitForState(final SystemState target);

  /**
   * Block until the machine is in target, is shut down, or timeoutMillis elapse (0 waits
   * indefinitely). Returns true only if target was reached. Requires thread-safety; without it
   * this returns false at once.
   */
  boolean waitForState(final SystemState target, final long timeoutMillis);


  ///// Registration /////
  /**
   * Replace the state change callback, null clears it.
   */
  void setStateChangeCallback(final StateChangeCallback callback);

  /**
   * Replace the callback gating transitions on event, null removes it.
   */
  void setEventCallback(final SystemEvent event, final EventCallback callback);

  /**
   * Replace the log sink, null mutes the machine.
   */
  void setLogCallback(final LogCallback callback);

  void enableThreadSafety(final boolean enable);

  boolean isThreadSafe();


  ///// Non-flow machine functions /////
  /**
   * Reports the id of this StateMachine instance. You can have as many instances as you like.
   */
  String getId();

  /**
   * Returns the config that this fsm is wired with.
   */
  StateMachineConfiguration getConfiguration();

  /**
   * Report statistics for this FSM.
   */
  StateMachineStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build FSMs.
   */
  public final static class StateMachineBuilder {
    private StateMachineConfiguration config;

    public static StateMachineBuilder newBuilder() {
      return new StateMachineBuilder();
    }

    public StateMachineBuilder config(final StateMachineConfiguration config) {
      this.config = config;
      return this;
    }

    public StateMachine build() {
      return new StateMachineImpl(config == null ? StateMachineConfiguration.defaults() : config);
    }

    private StateMachineBuilder() {}
  }

}
