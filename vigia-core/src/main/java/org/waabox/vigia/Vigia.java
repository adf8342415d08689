package org.waabox.vigia;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.client.ChangeListener;
import org.waabox.vigia.client.RealtimeClientFactory;
import org.waabox.vigia.client.RealtimeEndpoint;
import org.waabox.vigia.client.Resource;
import org.waabox.vigia.connection.ConnectionFactory;
import org.waabox.vigia.connection.ConnectionHealth;
import org.waabox.vigia.connection.ConnectionStatus;
import org.waabox.vigia.connection.Sleeper;
import org.waabox.vigia.metrics.NoopVigiaMetrics;
import org.waabox.vigia.metrics.VigiaMetrics;
import org.waabox.vigia.schedule.ExecutorTaskScheduler;
import org.waabox.vigia.schedule.TaskScheduler;
import org.waabox.vigia.subscription.RegistryStatus;
import org.waabox.vigia.subscription.SubscriptionRegistry;
import org.waabox.vigia.transport.PollTransport;
import org.waabox.vigia.transport.PushTransport;

/**
 * Main entry point of the synchronization layer.
 *
 * <p>Vigia owns one shared connection to a realtime service and any number
 * of topic subscriptions. Each topic receives row-level changes over a
 * push channel while the connection is healthy, falls back to periodic
 * polling when push fails, and returns to push once it recovers.
 *
 * <p>Usage:
 * <pre>{@code
 * Vigia vigia = Vigia.builder()
 *     .endpoint(new RealtimeEndpoint("https://realtime.example.com", key))
 *     .clientFactory(myClientFactory)
 *     .options(VigiaOptions.builder().pollingInterval(
 *         Duration.ofSeconds(10)).build())
 *     .build();
 *
 * vigia.initialize();
 * vigia.subscribe("orders", Resource.table("orders"), this::onOrderChange);
 * ...
 * vigia.destroy();
 * }</pre>
 *
 * <p>Every operation except {@link #initialize()} and {@link #destroy()}
 * requires an initialized, not yet destroyed instance.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Vigia {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Vigia.class);

  /** Runs every timer and background task, never null. */
  private final TaskScheduler scheduler;

  /** Whether the scheduler was created here and must be shut down. */
  private final boolean ownsScheduler;

  /** The shared connection, never null. */
  private final ConnectionFactory connectionFactory;

  /** The topics, never null. */
  private final SubscriptionRegistry registry;

  /** Whether initialize() has been called. */
  private final AtomicBoolean initialized = new AtomicBoolean(false);

  /** Whether destroy() has been called. */
  private final AtomicBoolean destroyed = new AtomicBoolean(false);

  private Vigia(final Builder builder) {
    ownsScheduler = builder.scheduler == null;
    scheduler = ownsScheduler ? new ExecutorTaskScheduler()
        : builder.scheduler;

    final VigiaOptions options = builder.options;
    connectionFactory = ConnectionFactory.builder(builder.endpoint,
            builder.clientFactory, scheduler)
        .options(options)
        .metrics(builder.metrics)
        .clock(builder.clock)
        .sleeper(builder.sleeper)
        .jitter(builder.jitter)
        .build();

    final PushTransport push = new PushTransport(connectionFactory,
        options.channelSubscribeTimeout());
    final PollTransport poll = new PollTransport(connectionFactory,
        scheduler, options.pollingInterval(), builder.metrics,
        builder.clock);

    registry = new SubscriptionRegistry(push, poll, connectionFactory,
        scheduler, options.reconnectionInterval(), options.pollingEnabled(),
        builder.metrics);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the background health probe of the shared connection.
   *
   * @throws IllegalStateException if already initialized or destroyed
   */
  public void initialize() {
    if (destroyed.get()) {
      throw new IllegalStateException("Vigia has been destroyed");
    }
    if (!initialized.compareAndSet(false, true)) {
      throw new IllegalStateException("Vigia has already been initialized");
    }
    connectionFactory.startHealthChecks();
    log.info("Vigia initialized");
  }

  /**
   * Subscribes a topic. A previous subscription with the same key is
   * replaced.
   *
   * @param key            the topic key, never null or blank
   * @param resource       the resource to follow, never null
   * @param changeListener receives the changes, never null
   *
   * @throws IllegalStateException if not initialized or destroyed
   */
  public void subscribe(final String key, final Resource resource,
      final ChangeListener changeListener) {
    subscribe(Subscription.of(key, resource, changeListener));
  }

  /**
   * Subscribes a topic with an error callback. A previous subscription
   * with the same key is replaced.
   *
   * @param key            the topic key, never null or blank
   * @param resource       the resource to follow, never null
   * @param changeListener receives the changes, never null
   * @param errorListener  receives the topic's transport errors, never null
   *
   * @throws IllegalStateException if not initialized or destroyed
   */
  public void subscribe(final String key, final Resource resource,
      final ChangeListener changeListener,
      final ErrorListener errorListener) {
    Objects.requireNonNull(errorListener, "errorListener cannot be null");
    subscribe(Subscription.of(key, resource, changeListener, errorListener));
  }

  /**
   * Subscribes a topic. Transport failures never escape this method; they
   * are reported to the subscription's error listener.
   *
   * @param subscription the subscription, never null
   *
   * @throws IllegalStateException if not initialized or destroyed
   */
  public void subscribe(final Subscription subscription) {
    Objects.requireNonNull(subscription, "subscription cannot be null");
    requireActive();
    registry.subscribe(subscription);
  }

  /**
   * Unsubscribes a topic. Unknown keys are ignored.
   *
   * @param key the topic key, never null
   *
   * @throws IllegalStateException if not initialized or destroyed
   */
  public void unsubscribe(final String key) {
    requireActive();
    registry.unsubscribe(key);
  }

  /**
   * Returns the current connection and topic status.
   *
   * @return the status report, never null
   *
   * @throws IllegalStateException if not initialized or destroyed
   */
  public ConnectionStatusReport connectionStatus() {
    requireActive();
    final ConnectionHealth health = connectionFactory.health();
    final RegistryStatus topics = registry.status();

    ConnectionStatus status = health.status();
    if (topics.pollingTopicCount() > 0
        && (status == ConnectionStatus.CONNECTED
            || status == ConnectionStatus.DISCONNECTED)) {
      status = ConnectionStatus.POLLING;
    }

    return new ConnectionStatusReport(status, health.failureCount(),
        connectionFactory.circuitState(), topics.activeTopicCount(),
        topics.pollingTopicCount(), topics.pendingTopicCount(),
        health.lastConnectedAt().orElse(null),
        health.nextRetryAt().orElse(null));
  }

  /**
   * Closes every channel, cancels every timer and releases the shared
   * connection. Calling it more than once has no effect.
   */
  public void destroy() {
    if (!destroyed.compareAndSet(false, true)) {
      return;
    }
    registry.destroy();
    connectionFactory.destroy();
    if (ownsScheduler) {
      scheduler.shutdown();
    }
    log.info("Vigia destroyed");
  }

  private void requireActive() {
    if (destroyed.get()) {
      throw new IllegalStateException("Vigia has been destroyed");
    }
    if (!initialized.get()) {
      throw new IllegalStateException(
          "Vigia has not been initialized, call initialize() first");
    }
  }

  /**
   * Builder for {@link Vigia}.
   *
   * <p>The endpoint and the client factory are required. Defaults: options
   * from {@link VigiaOptions#defaults()}, {@link NoopVigiaMetrics}, a
   * private {@link ExecutorTaskScheduler} shut down on destroy, the system
   * UTC clock, {@link Sleeper#THREAD} and a {@link ThreadLocalRandom}
   * jitter.
   */
  public static final class Builder {

    /** The realtime service, required. */
    private RealtimeEndpoint endpoint;

    /** Creates the underlying clients, required. */
    private RealtimeClientFactory clientFactory;

    /** The options, defaults to {@link VigiaOptions#defaults()}. */
    private VigiaOptions options = VigiaOptions.defaults();

    /** The metrics hook, defaults to a no-op. */
    private VigiaMetrics metrics = new NoopVigiaMetrics();

    /** The external scheduler, null to create a private one. */
    private TaskScheduler scheduler;

    /** The time source. */
    private Clock clock = Clock.systemUTC();

    /** Waits between connection attempts. */
    private Sleeper sleeper = Sleeper.THREAD;

    /** The backoff jitter source, values in [0, 1). */
    private DoubleSupplier jitter = () ->
        ThreadLocalRandom.current().nextDouble();

    private Builder() {
    }

    /**
     * Sets the realtime service to connect to.
     *
     * @param theEndpoint the endpoint, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theEndpoint is null
     */
    public Builder endpoint(final RealtimeEndpoint theEndpoint) {
      endpoint = Objects.requireNonNull(theEndpoint,
          "endpoint cannot be null");
      return this;
    }

    /**
     * Sets the factory of the underlying realtime clients.
     *
     * @param theClientFactory the client factory, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theClientFactory is null
     */
    public Builder clientFactory(
        final RealtimeClientFactory theClientFactory) {
      clientFactory = Objects.requireNonNull(theClientFactory,
          "clientFactory cannot be null");
      return this;
    }

    /**
     * Sets the connection, polling and reconnection options.
     *
     * @param theOptions the options, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theOptions is null
     */
    public Builder options(final VigiaOptions theOptions) {
      options = Objects.requireNonNull(theOptions, "options cannot be null");
      return this;
    }

    /**
     * Sets the hook notified of connection, transport and poll outcomes.
     *
     * @param theMetrics the metrics hook, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theMetrics is null
     */
    public Builder metrics(final VigiaMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics, "metrics cannot be null");
      return this;
    }

    /**
     * Sets an external scheduler. Vigia does not shut down an external
     * scheduler on destroy, but cancels every task it scheduled on it.
     *
     * @param theScheduler the scheduler, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theScheduler is null
     */
    public Builder scheduler(final TaskScheduler theScheduler) {
      scheduler = Objects.requireNonNull(theScheduler,
          "scheduler cannot be null");
      return this;
    }

    /**
     * Sets the clock used for backoff deadlines, health timestamps and
     * change events.
     *
     * @param theClock the clock, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theClock is null
     */
    public Builder clock(final Clock theClock) {
      clock = Objects.requireNonNull(theClock, "clock cannot be null");
      return this;
    }

    /**
     * Sets how the retry loop waits between attempts.
     *
     * @param theSleeper the sleeper, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theSleeper is null
     */
    public Builder sleeper(final Sleeper theSleeper) {
      sleeper = Objects.requireNonNull(theSleeper, "sleeper cannot be null");
      return this;
    }

    /**
     * Sets the source of the backoff jitter.
     *
     * @param theJitter supplies values in [0, 1), never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theJitter is null
     */
    public Builder jitter(final DoubleSupplier theJitter) {
      jitter = Objects.requireNonNull(theJitter, "jitter cannot be null");
      return this;
    }

    /**
     * Builds the Vigia instance. Nothing connects until the first
     * subscription.
     *
     * @return a new Vigia instance, never null
     *
     * @throws IllegalStateException if the endpoint or the client factory
     *                               is missing
     */
    public Vigia build() {
      if (endpoint == null) {
        throw new IllegalStateException("endpoint must be set");
      }
      if (clientFactory == null) {
        throw new IllegalStateException("clientFactory must be set");
      }
      return new Vigia(this);
    }
  }
}
