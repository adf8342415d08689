package org.waabox.vigia;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines the retry behavior for connection attempts: how many attempts
 * are made and how long to wait between them.
 *
 * <p>The wait before attempt {@code n + 1} is
 * {@code min(base * 2^(n-1) + jitter, maxDelay)}. The jitter is drawn
 * uniformly from {@code [0, min(1s, base))}, which keeps consecutive
 * delays non-decreasing for any base delay.
 *
 * <p>Instances are created through static factory methods. The default
 * policy uses 3 attempts, a 1-second base delay and a 30-second cap.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryPolicy {

  /** The default number of attempts. */
  private static final int DEFAULT_MAX_RETRIES = 3;

  /** The default base delay. */
  private static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);

  /** The default delay cap. */
  private static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

  /** The upper bound of the jitter added to each delay. */
  private static final long MAX_JITTER_MILLIS = 1000;

  /** The maximum number of attempts. */
  private final int maxRetries;

  /** The delay before the second attempt. */
  private final Duration baseDelay;

  /** The longest delay ever waited between attempts. */
  private final Duration maxDelay;

  /**
   * Creates a new retry policy.
   *
   * @param maxRetries the maximum number of attempts
   * @param baseDelay  the base delay, never null
   * @param maxDelay   the delay cap, never null
   */
  private RetryPolicy(final int maxRetries, final Duration baseDelay,
      final Duration maxDelay) {
    this.maxRetries = maxRetries;
    this.baseDelay = baseDelay;
    this.maxDelay = maxDelay;
  }

  /**
   * Creates a retry policy with the given parameters.
   *
   * @param maxRetries the maximum number of attempts, must be greater
   *                   than zero
   * @param baseDelay  the base delay, must be positive
   * @param maxDelay   the delay cap, must not be shorter than baseDelay
   * @return a new retry policy, never null
   *
   * @throws IllegalArgumentException if any value is out of range
   * @throws NullPointerException if a duration is null
   */
  public static RetryPolicy of(final int maxRetries,
      final Duration baseDelay, final Duration maxDelay) {
    if (maxRetries <= 0) {
      throw new IllegalArgumentException(
          "maxRetries must be greater than 0, got: " + maxRetries);
    }
    Objects.requireNonNull(baseDelay, "baseDelay must not be null");
    Objects.requireNonNull(maxDelay, "maxDelay must not be null");
    if (baseDelay.isNegative() || baseDelay.isZero()) {
      throw new IllegalArgumentException(
          "baseDelay must be positive, got: " + baseDelay);
    }
    if (maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException(
          "maxDelay must not be shorter than baseDelay, got: " + maxDelay);
    }
    return new RetryPolicy(maxRetries, baseDelay, maxDelay);
  }

  /**
   * Creates a retry policy with sensible defaults: 3 attempts, 1-second
   * base delay, 30-second cap.
   *
   * @return the default retry policy, never null
   */
  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY,
        DEFAULT_MAX_DELAY);
  }

  /**
   * Computes the delay to wait after the given failed attempt.
   *
   * @param attempt      the 1-based number of the attempt that failed
   * @param jitterSample a uniform sample in {@code [0, 1)}
   *
   * @return the delay, never null, never longer than {@link #maxDelay()}
   */
  public Duration delayAfter(final int attempt, final double jitterSample) {
    if (attempt <= 0) {
      throw new IllegalArgumentException(
          "attempt must be greater than 0, got: " + attempt);
    }
    final long base = baseDelay.toMillis();
    final long cap = maxDelay.toMillis();
    final int shift = Math.min(attempt - 1, 30);
    final long exponential = base > (cap >> shift) ? cap : base << shift;
    final long jitterBound = Math.min(MAX_JITTER_MILLIS, base);
    final long jitter = (long) (Math.max(0d, Math.min(jitterSample, 1d))
        * jitterBound);
    return Duration.ofMillis(Math.min(exponential + jitter, cap));
  }

  /**
   * Returns the maximum number of attempts.
   *
   * @return the maximum number of attempts, always greater than zero
   */
  public int maxRetries() {
    return maxRetries;
  }

  /**
   * Returns the base delay.
   *
   * @return the base delay, never null
   */
  public Duration baseDelay() {
    return baseDelay;
  }

  /**
   * Returns the delay cap. It is also the cool-down of an open circuit.
   *
   * @return the delay cap, never null
   */
  public Duration maxDelay() {
    return maxDelay;
  }
}
