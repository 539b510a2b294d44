package org.waabox.nexus;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Defines the retry behavior for page fetches.
 *
 * <p>The delay before retry {@code n} (zero based) is
 * {@code baseDelay * multiplier^n}, optionally stretched by a random
 * jitter of up to {@code jitterRatio} of that delay.
 *
 * <p>Instances are created through static factory methods. The default
 * policy uses 10 attempts with a 500 millisecond base delay doubling on
 * every attempt.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryPolicy {

  /** The default number of attempts. */
  private static final int DEFAULT_MAX_ATTEMPTS = 10;

  /** The default base delay. */
  private static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(500);

  /** The default backoff multiplier. */
  private static final double DEFAULT_MULTIPLIER = 2.0;

  /** The upper bound of a single computed delay. */
  private static final Duration MAX_DELAY = Duration.ofMinutes(5);

  /** The maximum number of attempts, including the first one. */
  private final int maxAttempts;

  /** The delay before the first retry. */
  private final Duration baseDelay;

  /** The factor applied to the delay on every further retry. */
  private final double multiplier;

  /** The fraction of the delay added at random, between 0 and 1. */
  private final double jitterRatio;

  private RetryPolicy(final int theMaxAttempts, final Duration theBaseDelay,
      final double theMultiplier, final double theJitterRatio) {
    maxAttempts = theMaxAttempts;
    baseDelay = theBaseDelay;
    multiplier = theMultiplier;
    jitterRatio = theJitterRatio;
  }

  /**
   * Creates an exponential retry policy without jitter.
   *
   * @param maxAttempts the maximum number of attempts, must be greater
   *                    than zero
   * @param baseDelay   the delay before the first retry, never null and
   *                    not negative
   *
   * @return a new retry policy, never null
   *
   * @throws IllegalArgumentException if maxAttempts is less than one or
   *                                  baseDelay is negative
   * @throws NullPointerException     if baseDelay is null
   */
  public static RetryPolicy of(final int maxAttempts,
      final Duration baseDelay) {
    return of(maxAttempts, baseDelay, DEFAULT_MULTIPLIER, 0);
  }

  /**
   * Creates a retry policy with every parameter specified.
   *
   * @param maxAttempts the maximum number of attempts, must be greater
   *                    than zero
   * @param baseDelay   the delay before the first retry, never null and
   *                    not negative
   * @param multiplier  the backoff multiplier, at least 1
   * @param jitterRatio the random jitter ratio, between 0 and 1
   *
   * @return a new retry policy, never null
   *
   * @throws IllegalArgumentException if any value is out of range
   * @throws NullPointerException     if baseDelay is null
   */
  public static RetryPolicy of(final int maxAttempts,
      final Duration baseDelay, final double multiplier,
      final double jitterRatio) {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException(
          "maxAttempts must be greater than 0, got: " + maxAttempts);
    }
    Objects.requireNonNull(baseDelay, "baseDelay must not be null");
    if (baseDelay.isNegative()) {
      throw new IllegalArgumentException(
          "baseDelay must not be negative, got: " + baseDelay);
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException(
          "multiplier must be at least 1, got: " + multiplier);
    }
    if (jitterRatio < 0 || jitterRatio > 1) {
      throw new IllegalArgumentException(
          "jitterRatio must be between 0 and 1, got: " + jitterRatio);
    }
    return new RetryPolicy(maxAttempts, baseDelay, multiplier, jitterRatio);
  }

  /**
   * Creates a retry policy with the defaults: 10 attempts, 500ms base
   * delay, doubling, no jitter.
   *
   * @return the default retry policy, never null
   */
  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY,
        DEFAULT_MULTIPLIER, 0);
  }

  /**
   * Returns the maximum number of attempts.
   *
   * @return the maximum number of attempts, always greater than zero
   */
  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Returns the delay before the first retry.
   *
   * @return the base delay, never null
   */
  public Duration baseDelay() {
    return baseDelay;
  }

  /**
   * Returns the backoff multiplier.
   *
   * @return the multiplier, at least 1
   */
  public double multiplier() {
    return multiplier;
  }

  /**
   * Returns the jitter ratio.
   *
   * @return the jitter ratio, between 0 and 1
   */
  public double jitterRatio() {
    return jitterRatio;
  }

  /**
   * Computes the delay to wait after the given failed attempt.
   *
   * @param attempt the zero based index of the attempt that failed
   *
   * @return the delay, never null and never above five minutes
   */
  public Duration delayAfter(final int attempt) {
    final double factor = Math.pow(multiplier, Math.max(0, attempt));
    double millis = baseDelay.toMillis() * factor;
    if (jitterRatio > 0 && millis > 0) {
      millis += ThreadLocalRandom.current().nextDouble(millis * jitterRatio);
    }
    final long bounded = (long) Math.min(millis, MAX_DELAY.toMillis());
    return Duration.ofMillis(bounded);
  }
}
