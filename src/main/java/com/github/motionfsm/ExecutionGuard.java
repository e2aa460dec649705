package com.github.motionfsm;

/**
 * Synchronization capability a {@link StateMachineImpl} runs its operations under. Either every
 * operation is a no-op ({@link UnguardedExecution}) or every operation goes through one mutex and
 * its condition ({@link MutexExecutionGuard}).
 */
interface ExecutionGuard {

  void enter();

  void exit();

  /**
   * Wake every thread blocked in {@link MutexExecutionGuard#await()}. Waiters re-check their own
   * predicate, there is no per-state signaling.
   */
  void signalAll();

  boolean isExclusive();

}
