package com.github.motionfsm;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One exclusive lock held for the full duration of every machine operation, lookup, callbacks and
 * commit included, plus the condition that state changes and shutdown broadcast on.
 */
final class MutexExecutionGuard implements ExecutionGuard {
  private final ReentrantLock lock;
  private final Condition stateChanged;

  MutexExecutionGuard(final boolean fair) {
    this.lock = new ReentrantLock(fair);
    this.stateChanged = lock.newCondition();
  }

  @Override
  public void enter() {
    lock.lock();
  }

  @Override
  public void exit() {
    lock.unlock();
  }

  /**
   * Takes the lock itself, so it is safe to call from a thread that does not hold it yet.
   */
  @Override
  public void signalAll() {
    lock.lock();
    try {
      stateChanged.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean isExclusive() {
    return true;
  }

  /**
   * Caller must hold the lock and re-check its predicate on return.
   */
  void await() throws InterruptedException {
    stateChanged.await();
  }

  /**
   * Caller must hold the lock and re-check its predicate on return. Returns the nanos left, <= 0
   * once the wait timed out.
   */
  long awaitNanos(final long nanos) throws InterruptedException {
    return stateChanged.awaitNanos(nanos);
  }

  @Override
  public String toString() {
    return "MutexExecutionGuard [fair=" + lock.isFair() + ", locked=" + lock.isLocked() + "]";
  }
}
