package org.waabox.nexus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link RetryPolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RetryPolicyTest {

  @Test
  void whenCreating_givenValidParams_shouldRetainValues() {
    final RetryPolicy policy = RetryPolicy.of(5, Duration.ofSeconds(10));

    assertEquals(5, policy.maxAttempts());
    assertEquals(Duration.ofSeconds(10), policy.baseDelay());
    assertEquals(2.0, policy.multiplier());
    assertEquals(0.0, policy.jitterRatio());
  }

  @Test
  void whenCreating_givenZeroAttempts_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        RetryPolicy.of(0, Duration.ofSeconds(1))
    );
  }

  @Test
  void whenCreating_givenNullDelay_shouldThrow() {
    assertThrows(NullPointerException.class, () ->
        RetryPolicy.of(3, null)
    );
  }

  @Test
  void whenCreating_givenNegativeDelay_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        RetryPolicy.of(3, Duration.ofSeconds(-5))
    );
  }

  @Test
  void whenCreating_givenMultiplierBelowOne_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        RetryPolicy.of(3, Duration.ofSeconds(1), 0.5, 0)
    );
  }

  @Test
  void whenCreating_givenJitterAboveOne_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        RetryPolicy.of(3, Duration.ofSeconds(1), 2, 1.5)
    );
  }

  @Test
  void whenUsingDefault_shouldRetryTenTimesFromHalfASecond() {
    final RetryPolicy policy = RetryPolicy.defaultPolicy();

    assertEquals(10, policy.maxAttempts());
    assertEquals(Duration.ofMillis(500), policy.baseDelay());
    assertEquals(2.0, policy.multiplier());
  }

  @Test
  void whenComputingDelay_givenDefaultPolicy_shouldDoubleEveryAttempt() {
    final RetryPolicy policy = RetryPolicy.defaultPolicy();

    assertEquals(Duration.ofMillis(500), policy.delayAfter(0));
    assertEquals(Duration.ofMillis(1000), policy.delayAfter(1));
    assertEquals(Duration.ofMillis(4000), policy.delayAfter(3));
  }

  @Test
  void whenComputingDelay_givenHugeAttempt_shouldCapAtFiveMinutes() {
    final RetryPolicy policy = RetryPolicy.of(100, Duration.ofSeconds(1));

    assertEquals(Duration.ofMinutes(5), policy.delayAfter(40));
  }

  @Test
  void whenComputingDelay_givenJitter_shouldStayWithinRatio() {
    final RetryPolicy policy = RetryPolicy.of(3, Duration.ofMillis(100), 2,
        0.5);

    for (int i = 0; i < 50; i++) {
      final long delay = policy.delayAfter(0).toMillis();
      assertTrue(delay >= 100 && delay <= 150, "delay was " + delay);
    }
  }
}
