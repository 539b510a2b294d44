package org.waabox.nexus;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A resettable one-shot signal readers block on until the data they query
 * has been loaded.
 *
 * <p>One writer flips the gate; any number of readers may wait on it. The
 * gate starts closed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ReadinessGate {

  /** Guards the ready flag transitions and the condition. */
  private final ReentrantLock lock = new ReentrantLock();

  /** Signaled every time the gate opens. */
  private final Condition opened = lock.newCondition();

  /** Cheap read path for {@link #isReady()}. */
  private volatile boolean ready;

  /** Opens the gate and wakes every waiting reader. */
  public void markReady() {
    lock.lock();
    try {
      ready = true;
      opened.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /** Closes the gate; subsequent waits block until it opens again. */
  public void markNotReady() {
    lock.lock();
    try {
      ready = false;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns whether the gate is open, without blocking.
   *
   * @return true if the gate is open
   */
  public boolean isReady() {
    return ready;
  }

  /**
   * Waits until the gate opens or the timeout elapses.
   *
   * <p>If the calling thread is interrupted the wait ends, the interrupt
   * flag is restored and the current state is returned.
   *
   * @param timeout the maximum time to wait, never null
   *
   * @return true if the gate is open, false if the timeout elapsed first
   */
  public boolean waitReady(final Duration timeout) {
    Objects.requireNonNull(timeout, "timeout must not be null");
    if (ready) {
      return true;
    }
    long remaining = timeout.toNanos();
    lock.lock();
    try {
      while (!ready) {
        if (remaining <= 0) {
          return false;
        }
        remaining = opened.awaitNanos(remaining);
      }
      return true;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return ready;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits like {@link #waitReady(Duration)}, for callers holding a unit.
   *
   * @param timeout the maximum time to wait
   * @param unit    the unit of the timeout, never null
   *
   * @return true if the gate is open, false if the timeout elapsed first
   */
  public boolean waitReady(final long timeout, final TimeUnit unit) {
    return waitReady(Duration.ofNanos(unit.toNanos(timeout)));
  }
}
