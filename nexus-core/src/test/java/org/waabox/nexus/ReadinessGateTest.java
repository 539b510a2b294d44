package org.waabox.nexus;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ReadinessGate}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ReadinessGateTest {

  @Test
  void whenCreated_shouldBeClosed() {
    final ReadinessGate gate = new ReadinessGate();

    assertFalse(gate.isReady());
    assertFalse(gate.waitReady(Duration.ZERO));
  }

  @Test
  void whenWaiting_givenNoSignal_shouldTimeOut() {
    final ReadinessGate gate = new ReadinessGate();

    final long start = System.nanoTime();
    assertFalse(gate.waitReady(Duration.ofMillis(100)));
    final long elapsed = TimeUnit.NANOSECONDS.toMillis(
        System.nanoTime() - start);

    assertTrue(elapsed >= 90, "waited only " + elapsed + "ms");
  }

  @Test
  void whenMarkedReady_givenManyWaiters_shouldReleaseAll() throws Exception {
    final ReadinessGate gate = new ReadinessGate();
    final int waiters = 8;
    final CountDownLatch waiting = new CountDownLatch(waiters);
    final CountDownLatch done = new CountDownLatch(waiters);
    final AtomicInteger released = new AtomicInteger();

    final List<Thread> threads = new ArrayList<>();
    for (int i = 0; i < waiters; i++) {
      final Thread thread = new Thread(() -> {
        waiting.countDown();
        if (gate.waitReady(Duration.ofSeconds(10))) {
          released.incrementAndGet();
        }
        done.countDown();
      });
      threads.add(thread);
      thread.start();
    }

    assertTrue(waiting.await(5, TimeUnit.SECONDS));
    gate.markReady();

    assertTrue(done.await(5, TimeUnit.SECONDS));
    assertTrue(released.get() == waiters);
    assertTrue(gate.isReady());
  }

  @Test
  void whenMarkedNotReady_givenOpenGate_shouldCloseIt() {
    final ReadinessGate gate = new ReadinessGate();
    gate.markReady();

    gate.markNotReady();

    assertFalse(gate.isReady());
    assertFalse(gate.waitReady(10, TimeUnit.MILLISECONDS));
  }

  @Test
  void whenWaiting_givenInterruptedThread_shouldReturnAndKeepFlag() {
    final ReadinessGate gate = new ReadinessGate();

    Thread.currentThread().interrupt();
    try {
      assertFalse(gate.waitReady(Duration.ofSeconds(5)));
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }
}
