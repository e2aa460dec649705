package com.github.motionfsm;

/**
 * Single-threaded strategy: nothing is locked and nothing is signaled.
 */
final class UnguardedExecution implements ExecutionGuard {
  static final UnguardedExecution instance = new UnguardedExecution();

  @Override
  public void enter() {}

  @Override
  public void exit() {}

  @Override
  public void signalAll() {}

  @Override
  public boolean isExclusive() {
    return false;
  }

  @Override
  public String toString() {
    return "UnguardedExecution";
  }

  private UnguardedExecution() {}
}
