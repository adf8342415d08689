package org.waabox.vigia;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning options for a {@link Vigia} instance.
 *
 * <p>Instances are created through {@link #defaults()} or the fluent
 * {@link Builder}. Defaults:
 * <ul>
 *   <li>maxRetries: 3</li>
 *   <li>baseRetryDelay: 1 second</li>
 *   <li>maxRetryDelay: 30 seconds (also the open-circuit cool-down)</li>
 *   <li>circuitBreakerThreshold: 5 failures</li>
 *   <li>healthCheckInterval: 30 seconds</li>
 *   <li>pollingInterval: 5 seconds</li>
 *   <li>reconnectionInterval: 60 seconds</li>
 *   <li>probeTimeout: 10 seconds</li>
 *   <li>channelSubscribeTimeout: 10 seconds</li>
 *   <li>pollingEnabled: true</li>
 * </ul>
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class VigiaOptions {

  /** The retry policy built from the retry options, never null. */
  private final RetryPolicy retryPolicy;

  /** Failures needed to open the circuit. */
  private final int circuitBreakerThreshold;

  /** Interval of the background health probe, never null. */
  private final Duration healthCheckInterval;

  /** Interval between poll ticks, never null. */
  private final Duration pollingInterval;

  /** Interval between reconnection attempts, never null. */
  private final Duration reconnectionInterval;

  /** Timeout of a single connectivity probe, never null. */
  private final Duration probeTimeout;

  /** How long a push channel may take to report SUBSCRIBED, never null. */
  private final Duration channelSubscribeTimeout;

  /** Whether topics fall back to polling when push fails. */
  private final boolean pollingEnabled;

  private VigiaOptions(final Builder builder) {
    retryPolicy = RetryPolicy.of(builder.maxRetries, builder.baseRetryDelay,
        builder.maxRetryDelay);
    circuitBreakerThreshold = builder.circuitBreakerThreshold;
    healthCheckInterval = builder.healthCheckInterval;
    pollingInterval = builder.pollingInterval;
    reconnectionInterval = builder.reconnectionInterval;
    probeTimeout = builder.probeTimeout;
    channelSubscribeTimeout = builder.channelSubscribeTimeout;
    pollingEnabled = builder.pollingEnabled;
  }

  /**
   * Returns the default options.
   *
   * @return the default options, never null
   */
  public static VigiaOptions defaults() {
    return builder().build();
  }

  /**
   * Creates a new builder initialized with the default values.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  public int circuitBreakerThreshold() {
    return circuitBreakerThreshold;
  }

  public Duration healthCheckInterval() {
    return healthCheckInterval;
  }

  public Duration pollingInterval() {
    return pollingInterval;
  }

  public Duration reconnectionInterval() {
    return reconnectionInterval;
  }

  public Duration probeTimeout() {
    return probeTimeout;
  }

  public Duration channelSubscribeTimeout() {
    return channelSubscribeTimeout;
  }

  public boolean pollingEnabled() {
    return pollingEnabled;
  }

  /** A fluent builder for {@link VigiaOptions}. */
  public static final class Builder {

    /** Maximum connection attempts per gated sequence. */
    private int maxRetries = 3;

    /** Base delay between attempts. */
    private Duration baseRetryDelay = Duration.ofSeconds(1);

    /** Delay cap and circuit cool-down. */
    private Duration maxRetryDelay = Duration.ofSeconds(30);

    /** Failures needed to open the circuit. */
    private int circuitBreakerThreshold = 5;

    /** Health probe interval. */
    private Duration healthCheckInterval = Duration.ofSeconds(30);

    /** Poll tick interval. */
    private Duration pollingInterval = Duration.ofSeconds(5);

    /** Reconnection tick interval. */
    private Duration reconnectionInterval = Duration.ofSeconds(60);

    /** Connectivity probe timeout. */
    private Duration probeTimeout = Duration.ofSeconds(10);

    /** Push channel subscribe timeout. */
    private Duration channelSubscribeTimeout = Duration.ofSeconds(10);

    /** Whether polling fallback is enabled. */
    private boolean pollingEnabled = true;

    private Builder() {
    }

    /**
     * Sets the maximum number of connection attempts per gated sequence.
     *
     * @param theMaxRetries the attempts, must be greater than zero
     *
     * @return this builder for chaining, never null
     */
    public Builder maxRetries(final int theMaxRetries) {
      if (theMaxRetries <= 0) {
        throw new IllegalArgumentException(
            "maxRetries must be greater than 0, got: " + theMaxRetries);
      }
      maxRetries = theMaxRetries;
      return this;
    }

    /**
     * Sets the base delay between connection attempts.
     *
     * @param theDelay the delay, must be positive
     *
     * @return this builder for chaining, never null
     */
    public Builder baseRetryDelay(final Duration theDelay) {
      baseRetryDelay = requirePositive(theDelay, "baseRetryDelay");
      return this;
    }

    /**
     * Sets the delay cap between attempts, which is also how long the
     * circuit stays open.
     *
     * @param theDelay the delay, must be positive
     *
     * @return this builder for chaining, never null
     */
    public Builder maxRetryDelay(final Duration theDelay) {
      maxRetryDelay = requirePositive(theDelay, "maxRetryDelay");
      return this;
    }

    /**
     * Sets the number of failures that opens the circuit.
     *
     * @param theThreshold the threshold, must be greater than zero
     *
     * @return this builder for chaining, never null
     */
    public Builder circuitBreakerThreshold(final int theThreshold) {
      if (theThreshold <= 0) {
        throw new IllegalArgumentException(
            "circuitBreakerThreshold must be greater than 0, got: "
                + theThreshold);
      }
      circuitBreakerThreshold = theThreshold;
      return this;
    }

    public Builder healthCheckInterval(final Duration theInterval) {
      healthCheckInterval = requirePositive(theInterval,
          "healthCheckInterval");
      return this;
    }

    public Builder pollingInterval(final Duration theInterval) {
      pollingInterval = requirePositive(theInterval, "pollingInterval");
      return this;
    }

    public Builder reconnectionInterval(final Duration theInterval) {
      reconnectionInterval = requirePositive(theInterval,
          "reconnectionInterval");
      return this;
    }

    public Builder probeTimeout(final Duration theTimeout) {
      probeTimeout = requirePositive(theTimeout, "probeTimeout");
      return this;
    }

    public Builder channelSubscribeTimeout(final Duration theTimeout) {
      channelSubscribeTimeout = requirePositive(theTimeout,
          "channelSubscribeTimeout");
      return this;
    }

    /**
     * Enables or disables the polling fallback. When disabled, a topic
     * whose push transport fails stays without transport until the
     * reconnection scheduler restores push.
     *
     * @param enabled whether polling is enabled
     *
     * @return this builder for chaining, never null
     */
    public Builder pollingEnabled(final boolean enabled) {
      pollingEnabled = enabled;
      return this;
    }

    /**
     * Builds the options.
     *
     * @return the options, never null
     *
     * @throws IllegalArgumentException if maxRetryDelay is shorter than
     *                                  baseRetryDelay
     */
    public VigiaOptions build() {
      return new VigiaOptions(this);
    }

    private static Duration requirePositive(final Duration value,
        final String name) {
      Objects.requireNonNull(value, name + " must not be null");
      if (value.isNegative() || value.isZero()) {
        throw new IllegalArgumentException(
            name + " must be positive, got: " + value);
      }
      return value;
    }
  }
}
