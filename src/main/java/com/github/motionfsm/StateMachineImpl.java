package com.github.motionfsm;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.motionfsm.StateMachineException.Code;
import com.github.motionfsm.TransitionResult.Outcome;

/**
 * The motion pipeline FSM engine.
 *
 * Notes for users:<br>
 * 1. the transition table is built eagerly in the constructor and is read-only afterwards, so it
 * needs no synchronization of its own. The state pair and the callback slots are the only mutable
 * shared state<br>
 *
 * 2. thread-safety is a strategy swapped by {@link #enableThreadSafety(boolean)}: either
 * {@link UnguardedExecution}, which costs nothing and makes concurrent use undefined, or
 * {@link MutexExecutionGuard}, which serializes every operation on one lock. Both are allocated up
 * front, no operation allocates a lock wrapper<br>
 *
 * 3. every commit and every shutdown broadcasts to all threads in waitForState. A broadcast wakes
 * every waiter regardless of the state it waits for, so each waiter loops on its own predicate<br>
 *
 * 4. callback failures never escape. An event callback that throws counts as a veto, a state change
 * callback that throws is logged after the fact and the commit stands<br>
 */
public final class StateMachineImpl implements StateMachine {
  private static final Logger logger = LogManager.getLogger(StateMachineImpl.class.getSimpleName());

  private static final DateTimeFormatter timestampFormat = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

  private final String machineId = UUID.randomUUID().toString();
  private final StateMachineConfiguration config;
  private final TransitionTable transitionTable;

  private final MutexExecutionGuard mutexGuard;
  private volatile ExecutionGuard guard = UnguardedExecution.instance;

  private volatile boolean running;
  private volatile boolean shutdownInvoked;
  // current and previous always change together
  private SystemState currentState = SystemState.IDLE;
  private SystemState previousState = SystemState.IDLE;
  // reserved for trajectory execution tracking, nothing advances it yet
  private long executionProgress;
  // true while a callback runs on behalf of this machine
  private boolean inCallback;

  private StateChangeCallback stateChangeCallback;
  private final Map<SystemEvent, EventCallback> eventCallbacks = new EnumMap<>(SystemEvent.class);
  private LogCallback logCallback;

  private final long startTstampMillis = System.currentTimeMillis();
  private long committedTransitions;
  private long rejectedEvents;
  private long vetoedEvents;
  private long failedEventCallbacks;
  private long stateChangeCallbackFaults;
  private long resets;
  private long lastTransitionMillis;

  public StateMachineImpl() {
    this(StateMachineConfiguration.defaults());
  }

  public StateMachineImpl(final StateMachineConfiguration config) {
    this.config = config == null ? StateMachineConfiguration.defaults() : config;
    this.transitionTable = TransitionTable.motionPipeline();
    this.mutexGuard = new MutexExecutionGuard(this.config.isFairLock());
    this.logCallback = new Log4jLogCallback(this.config.getLogTag());
    if (this.config.isThreadSafe()) {
      guard = mutexGuard;
    }
    logInfo(machineId, "Hydrated transition table with " + transitionTable.size()
        + " transitions, config: " + this.config);
  }

  @Override
  public boolean initialize() {
    final ExecutionGuard guard = this.guard;
    guard.enter();
    try {
      currentState = SystemState.IDLE;
      previousState = SystemState.IDLE;
      running = true;
      shutdownInvoked = false;
      executionProgress = 0L;
      logMessage("State machine initialized");
      guard.signalAll();
    } finally {
      guard.exit();
    }
    return true;
  }

  @Override
  public void start() {
    final ExecutionGuard guard = this.guard;
    guard.enter();
    try {
      logMessage("Starting state machine");
      running = true;
      shutdownInvoked = false;
      currentState = SystemState.IDLE;
      guard.signalAll();
    } finally {
      guard.exit();
    }
  }

  @Override
  public void stop() {
    triggerEvent(SystemEvent.STOP_REQUEST);
  }

  @Override
  public void reset() {
    final ExecutionGuard guard = this.guard;
    guard.enter();
    try {
      if (inCallback) {
        logMessage("Refusing reset requested from inside a callback");
        return;
      }
      logMessage("Resetting state machine");
      previousState = currentState;
      currentState = SystemState.IDLE;
      resets++;
      lastTransitionMillis = System.currentTimeMillis();
      onStateChanged(previousState, currentState);
    } finally {
      guard.exit();
    }
  }

  @Override
  public void shutdown() {
    final ExecutionGuard guard = this.guard;
    guard.enter();
    try {
      logMessage("Shutting down state machine");
      running = false;
      shutdownInvoked = true;
    } finally {
      guard.exit();
    }
    // waiters always sit on the mutex, even if thread-safety was switched off after they blocked
    mutexGuard.signalAll();
  }

  @Override
  public boolean alive() {
    return running;
  }

  @Override
  public void close() {
    if (!shutdownInvoked) {
      shutdown();
    }
  }

  @Override
  public boolean triggerEvent(final SystemEvent event) {
    return triggerEvent(event, "");
  }

  @Override
  public boolean triggerEvent(final SystemEvent event, final String data) {
    return fireEvent(event, data).isSuccessful();
  }

  @Override
  public TransitionResult fireEvent(final SystemEvent event, final String data) {
    final ExecutionGuard guard = this.guard;
    guard.enter();
    try {
      return dispatch(event, data == null ? "" : data);
    } finally {
      guard.exit();
    }
  }

  /**
   * Lookup, gate, commit. Caller holds the guard.
   */
  private TransitionResult dispatch(final SystemEvent event, final String data) {
    final SystemState fromState = currentState;
    String description;
    if (inCallback) {
      description = "Refusing event " + eventToString(event) + " fired from inside a callback";
      logMessage(description);
      return TransitionResult.failed(Outcome.REENTRANT_CALL, event, fromState, null, description);
    }
    if (!transitionTable.hasState(fromState)) {
      description = "No transitions found for state " + stateToString(fromState);
      logMessage(description);
      rejectedEvents++;
      return TransitionResult.failed(Outcome.REJECTED, event, fromState, null, description);
    }
    final SystemState toState = transitionTable.lookup(fromState, event);
    if (toState == null) {
      description = "State " + stateToString(fromState) + " does not support event "
          + eventToString(event);
      logMessage(description);
      rejectedEvents++;
      return TransitionResult.failed(Outcome.REJECTED, event, fromState, null, description);
    }

    final EventCallback eventCallback = eventCallbacks.get(event);
    if (eventCallback != null) {
      boolean approved = false;
      inCallback = true;
      try {
        approved = eventCallback.onEvent(event, data);
      } catch (Exception problem) {
        description = "Event callback threw for " + eventToString(event) + ": " + problem;
        logMessage(description);
        logWarning(machineId, description, problem);
        failedEventCallbacks++;
        return TransitionResult.failed(Outcome.CALLBACK_FAILED, event, fromState, toState,
            description, new StateMachineException(Code.EVENT_CALLBACK_FAILURE, problem));
      } finally {
        inCallback = false;
      }
      if (!approved) {
        description = "Event callback failed: " + eventToString(event);
        logMessage(description);
        vetoedEvents++;
        return TransitionResult.failed(Outcome.CALLBACK_VETOED, event, fromState, toState,
            description);
      }
    }

    return executeTransition(fromState, toState, event);
  }

  /**
   * Re-validates the edge and commits it. The state change callback sees the committed pair and
   * cannot undo it.
   */
  private TransitionResult executeTransition(final SystemState fromState,
      final SystemState toState, final SystemEvent event) {
    String description;
    if (!transitionTable.isValid(fromState, toState, event)) {
      description =
          "Invalid transition: " + stateToString(fromState) + " -> " + stateToString(toState);
      logMessage(description);
      return TransitionResult.failed(Outcome.INVALID_TRANSITION, event, fromState, toState,
          description);
    }

    previousState = currentState;
    currentState = toState;
    committedTransitions++;
    lastTransitionMillis = System.currentTimeMillis();

    description = "State transition: " + stateToString(fromState) + " -> "
        + stateToString(toState) + " on " + eventToString(event);
    logMessage(description);

    final StateMachineException fault = onStateChanged(previousState, currentState);
    return TransitionResult.committed(event, fromState, toState, description, fault);
  }

  /**
   * Notify the state change callback, then wake every waiter, whether or not the callback threw.
   * Returns the callback's failure, if any.
   */
  private StateMachineException onStateChanged(final SystemState oldState,
      final SystemState newState) {
    StateMachineException fault = null;
    final StateChangeCallback callback = stateChangeCallback;
    if (callback != null) {
      inCallback = true;
      try {
        callback.onStateChange(oldState, newState);
      } catch (Exception problem) {
        final String description = "State change callback threw for " + stateToString(oldState)
            + " -> " + stateToString(newState) + ": " + problem;
        logMessage(description);
        logWarning(machineId, description, problem);
        stateChangeCallbackFaults++;
        fault = new StateMachineException(Code.STATE_CHANGE_CALLBACK_FAILURE, problem);
      } finally {
        inCallback = false;
        guard.signalAll();
      }
    } else {
      guard.signalAll();
    }
    return fault;
  }

  @Override
  public SystemState getCurrentState() {
    final ExecutionGuard guard = this.guard;
    guard.enter();
    try {
      return currentState;
    } finally {
      guard.exit();
    }
  }

  @Override
  public SystemState getPreviousState() {
    final ExecutionGuard guard = this.guard;
    guard.enter();
    try {
      return previousState;
    } finally {
      guard.exit();
    }
  }

  @Override
  public String getCurrentStateName() {
    return stateToString(getCurrentState());
  }

  @Override
  public boolean isInState(final SystemState state) {
    return getCurrentState() == state;
  }

  @Override
  public boolean canTransition(final SystemEvent event) {
    final ExecutionGuard guard = this.guard;
    guard.enter();
    try {
      return transitionTable.hasState(currentState)
          && transitionTable.lookup(currentState, event) != null;
    } finally {
      guard.exit();
    }
  }

  @Override
  public TransitionTable getTransitionTable() {
    return transitionTable;
  }

  @Override
  public boolean waitForState(final SystemState target) {
    return waitForState(target, 0L);
  }

  @Override
  public boolean waitForState(final SystemState target, final long timeoutMillis) {
    if (!guard.isExclusive()) {
      logMessage("The wait state feature requires thread safety to be enabled");
      return false;
    }
    if (target == null || timeoutMillis < 0L) {
      logMessage(String.format("Refusing to wait for state %s with timeout %dms",
          stateToString(target), timeoutMillis));
      return false;
    }
    mutexGuard.enter();
    try {
      if (currentState == target) {
        return true;
      }
      if (timeoutMillis > 0L) {
        long remainingNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        while (currentState != target && running) {
          if (remainingNanos <= 0L) {
            logDebug(machineId, "Timed out after " + timeoutMillis + "ms waiting for "
                + stateToString(target));
            return false;
          }
          remainingNanos = mutexGuard.awaitNanos(remainingNanos);
        }
      } else {
        while (currentState != target && running) {
          mutexGuard.await();
        }
      }
      return currentState == target;
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      logMessage("Interrupted while waiting for state " + stateToString(target));
      return false;
    } finally {
      mutexGuard.exit();
    }
  }

  @Override
  public void setStateChangeCallback(final StateChangeCallback callback) {
    final ExecutionGuard guard = this.guard;
    guard.enter();
    try {
      stateChangeCallback = callback;
      logMessage(
          callback != null ? "State change callback registered" : "State change callback cleared");
    } finally {
      guard.exit();
    }
  }

  @Override
  public void setEventCallback(final SystemEvent event, final EventCallback callback) {
    final ExecutionGuard guard = this.guard;
    guard.enter();
    try {
      if (event == null) {
        logMessage("Cannot register an event callback for " + eventToString(event));
        return;
      }
      if (callback != null) {
        eventCallbacks.put(event, callback);
        logMessage("Registered event callback: " + eventToString(event));
      } else {
        eventCallbacks.remove(event);
        logMessage("Removed event callback: " + eventToString(event));
      }
    } finally {
      guard.exit();
    }
  }

  @Override
  public void setLogCallback(final LogCallback callback) {
    final ExecutionGuard guard = this.guard;
    guard.enter();
    try {
      logCallback = callback;
    } finally {
      guard.exit();
    }
  }

  /**
   * Not synchronized with in-flight operations. Flip it while no other thread is inside the
   * machine.
   */
  @Override
  public void enableThreadSafety(final boolean enable) {
    guard = enable ? mutexGuard : UnguardedExecution.instance;
    logDebug(machineId, "Thread safety " + (enable ? "enabled" : "disabled"));
  }

  @Override
  public boolean isThreadSafe() {
    return guard.isExclusive();
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public StateMachineConfiguration getConfiguration() {
    return config;
  }

  @Override
  public StateMachineStatistics getStatistics() {
    final ExecutionGuard guard = this.guard;
    guard.enter();
    try {
      return new StateMachineStatistics(machineId, startTstampMillis, committedTransitions,
          rejectedEvents, vetoedEvents, failedEventCallbacks, stateChangeCallbackFaults, resets,
          lastTransitionMillis);
    } finally {
      guard.exit();
    }
  }

  /**
   * Reserved counter, reset by {@link #initialize()} and not advanced by any transition.
   */
  public long getExecutionProgress() {
    final ExecutionGuard guard = this.guard;
    guard.enter();
    try {
      return executionProgress;
    } finally {
      guard.exit();
    }
  }

  /**
   * Write one timestamped line to the active log sink. A sink that throws is reported to the
   * internal logger.
   */
  void logMessage(final String message) {
    final LogCallback sink = logCallback;
    if (sink == null) {
      return;
    }
    final String line = "[" + LocalTime.now().format(timestampFormat) + "] " + message;
    try {
      sink.log(line);
    } catch (RuntimeException problem) {
      logWarning(machineId, "Log callback failed to write: " + line, problem);
    }
  }

  public static String stateToString(final SystemState state) {
    if (state == null) {
      return "UNKNOWN";
    }
    switch (state) {
      case IDLE:
        return "IDLE";
      case MOVEIT_STARTING:
        return "MOVEIT_STARTING";
      case PLANNING:
        return "PLANNING";
      case EXECUTING:
        return "EXECUTING";
      case OBSTACLE_DETECTED:
        return "OBSTACLE_DETECTED";
      case ERROR:
        return "ERROR";
      default:
        return "UNKNOWN";
    }
  }

  public static String eventToString(final SystemEvent event) {
    if (event == null) {
      return "UNKNOWN_EVENT";
    }
    switch (event) {
      case START_MOVEIT:
        return "START_MOVEIT";
      case MOVEIT_READY:
        return "MOVEIT_READY";
      case MOVEIT_FAILED:
        return "MOVEIT_FAILED";
      case START_PLANNING:
        return "START_PLANNING";
      case PLANNING_SUCCESS:
        return "PLANNING_SUCCESS";
      case PLANNING_FAILED:
        return "PLANNING_FAILED";
      case EXECUTION_COMPLETE:
        return "EXECUTION_COMPLETE";
      case OBSTACLE_APPEARED:
        return "OBSTACLE_APPEARED";
      case OBSTACLE_CLEARED:
        return "OBSTACLE_CLEARED";
      case STOP_REQUEST:
        return "STOP_REQUEST";
      case ERROR_OCCURRED:
        return "ERROR_OCCURRED";
      case RESET_REQUEST:
        return "RESET_REQUEST";
      default:
        return "UNKNOWN_EVENT";
    }
  }

  private static void logWarning(final String machineId, final String message,
      final Throwable error) {
    logger.warn(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString(), error);
  }

  private static void logInfo(final String machineId, final String message) {
    logger.info(
        new StringBuilder().append("[m:").append(machineId).append("] ").append(message).toString());
  }

  private static void logDebug(final String machineId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("] ")
          .append(message).toString());
    }
  }

  @Override
  public String toString() {
    return "StateMachineImpl [machineId=" + machineId + ", running=" + running + ", guard=" + guard
        + "]";
  }
}
