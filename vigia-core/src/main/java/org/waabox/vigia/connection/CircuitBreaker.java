package org.waabox.vigia.connection;

import java.time.Instant;
import java.util.Objects;

/**
 * Gates connection attempts based on the failure count of a
 * {@link ConnectionHealth}.
 *
 * <p>The breaker holds no state of its own; the state is derived from the
 * health snapshot and the current instant:
 * <ul>
 *   <li>{@link CircuitState#CLOSED}: failures below the threshold.</li>
 *   <li>{@link CircuitState#OPEN}: failures at or above the threshold and
 *       {@code now} before {@code nextRetryAt}.</li>
 *   <li>{@link CircuitState#HALF_OPEN}: failures at or above the threshold
 *       and the cool-down elapsed (or never set).</li>
 * </ul>
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CircuitBreaker {

  /** Failures needed to open the circuit. */
  private final int threshold;

  /**
   * Creates a new circuit breaker.
   *
   * @param theThreshold failures needed to open the circuit, must be
   *                     greater than zero
   */
  public CircuitBreaker(final int theThreshold) {
    if (theThreshold <= 0) {
      throw new IllegalArgumentException(
          "threshold must be greater than 0, got: " + theThreshold);
    }
    threshold = theThreshold;
  }

  /**
   * Derives the circuit state.
   *
   * @param health the current health, never null
   * @param now    the current instant, never null
   *
   * @return the circuit state, never null
   */
  public CircuitState state(final ConnectionHealth health,
      final Instant now) {
    Objects.requireNonNull(health, "health cannot be null");
    Objects.requireNonNull(now, "now cannot be null");

    if (health.failureCount() < threshold) {
      return CircuitState.CLOSED;
    }
    final boolean coolingDown = health.nextRetryAt()
        .map(now::isBefore)
        .orElse(false);
    return coolingDown ? CircuitState.OPEN : CircuitState.HALF_OPEN;
  }

  /**
   * Returns the failure count a half-open probe starts from: half the
   * threshold, so the probe's own failures can reopen the circuit.
   *
   * @return the half-open failure count
   */
  int halfOpenFailureCount() {
    return threshold / 2;
  }

  /**
   * Returns the failure count after a failed half-open probe, which is
   * always enough to reopen the circuit.
   *
   * @param current the failure count after the probe
   *
   * @return the reopening failure count
   */
  int reopenFailureCount(final int current) {
    return Math.max(current, threshold);
  }

  /**
   * Returns the failure threshold.
   *
   * @return the threshold, always greater than zero
   */
  public int threshold() {
    return threshold;
  }
}
