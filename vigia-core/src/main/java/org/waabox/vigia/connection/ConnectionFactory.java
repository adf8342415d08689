package org.waabox.vigia.connection;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.DoubleSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.RetryPolicy;
import org.waabox.vigia.VigiaOptions;
import org.waabox.vigia.client.ClientCreationException;
import org.waabox.vigia.client.RealtimeClient;
import org.waabox.vigia.client.RealtimeClientFactory;
import org.waabox.vigia.client.RealtimeEndpoint;
import org.waabox.vigia.metrics.NoopVigiaMetrics;
import org.waabox.vigia.metrics.VigiaMetrics;
import org.waabox.vigia.schedule.ScheduledTask;
import org.waabox.vigia.schedule.TaskScheduler;

/**
 * Owns the single {@link RealtimeClient} shared by every subscription.
 *
 * <p>Connection attempts are gated by a {@link CircuitBreaker} and retried
 * with exponential backoff and jitter. Concurrent callers of
 * {@link #getConnection()} join the same in-flight attempt, so at most one
 * client is created per attempt. The thread that starts an attempt runs
 * the retry loop; the others wait on its outcome.
 *
 * <p>Once started, a background probe checks the cached client every
 * health check interval. A failed probe drops the cached client, marks
 * the connection {@link ConnectionStatus#POLLING} and notifies the
 * registered {@link ConnectionHealthListener}s.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConnectionFactory {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ConnectionFactory.class);

  /** The remote service, never null. */
  private final RealtimeEndpoint endpoint;

  /** Creates the underlying clients, never null. */
  private final RealtimeClientFactory clientFactory;

  /** The attempts and backoff of a gated sequence, never null. */
  private final RetryPolicy retryPolicy;

  /** Gates the connection attempts, never null. */
  private final CircuitBreaker circuitBreaker;

  /** Timeout of a single connectivity probe, never null. */
  private final Duration probeTimeout;

  /** Interval of the background health probe, never null. */
  private final Duration healthCheckInterval;

  /** Runs the probes and the health check timer, never null. */
  private final TaskScheduler scheduler;

  /** The metrics hook, never null. */
  private final VigiaMetrics metrics;

  /** The time source, never null. */
  private final Clock clock;

  /** Waits between attempts, never null. */
  private final Sleeper sleeper;

  /** Supplies uniform samples in [0, 1) for the backoff jitter. */
  private final DoubleSupplier jitter;

  /** The health listeners. */
  private final List<ConnectionHealthListener> listeners =
      new CopyOnWriteArrayList<>();

  /** Guards every mutable field below. */
  private final Object lock = new Object();

  /** The current health, never null. */
  private ConnectionHealth health = ConnectionHealth.initial();

  /** The cached healthy client, null when there is none. */
  private RealtimeClient client;

  /** The attempt in flight, null when there is none. */
  private CompletableFuture<RealtimeClient> inFlight;

  /** The background health probe, null until started. */
  private ScheduledTask healthProbe;

  /** Whether destroy() was called. */
  private boolean destroyed;

  private ConnectionFactory(final Builder builder) {
    endpoint = builder.endpoint;
    clientFactory = builder.clientFactory;
    retryPolicy = builder.options.retryPolicy();
    circuitBreaker = new CircuitBreaker(
        builder.options.circuitBreakerThreshold());
    probeTimeout = builder.options.probeTimeout();
    healthCheckInterval = builder.options.healthCheckInterval();
    scheduler = builder.scheduler;
    metrics = builder.metrics;
    clock = builder.clock;
    sleeper = builder.sleeper;
    jitter = builder.jitter;
  }

  /**
   * Creates a new builder.
   *
   * @param endpoint      the remote service, never null
   * @param clientFactory creates the underlying clients, never null
   * @param scheduler     runs the probes and timers, never null
   *
   * @return a new builder, never null
   */
  public static Builder builder(final RealtimeEndpoint endpoint,
      final RealtimeClientFactory clientFactory,
      final TaskScheduler scheduler) {
    return new Builder(endpoint, clientFactory, scheduler);
  }

  /**
   * Returns the shared client, connecting if needed.
   *
   * @return the healthy shared client, never null
   *
   * @throws ConnectionUnavailableException if the circuit is open or every
   *                                        attempt failed
   * @throws IllegalStateException          if the factory was destroyed
   */
  public RealtimeClient getConnection() {
    final CompletableFuture<RealtimeClient> attempt;
    boolean owner = false;
    boolean halfOpen = false;

    synchronized (lock) {
      requireNotDestroyed();
      if (client != null) {
        return client;
      }
      if (inFlight != null) {
        attempt = inFlight;
      } else {
        final CircuitState state = circuitBreaker.state(health,
            clock.instant());
        if (state == CircuitState.OPEN) {
          metrics.circuitRejected();
          log.debug("Circuit open, rejecting connection until {}",
              health.nextRetryAt().orElse(null));
          throw new ConnectionUnavailableException("circuit open",
              health.nextRetryAt().orElse(null), null);
        }
        halfOpen = state == CircuitState.HALF_OPEN;
        if (halfOpen) {
          log.info("Circuit half-open, probing {}", endpoint.url());
          health = health.withFailureCount(
              circuitBreaker.halfOpenFailureCount());
        }
        health = health.withStatus(ConnectionStatus.CONNECTING);
        inFlight = new CompletableFuture<>();
        attempt = inFlight;
        owner = true;
      }
    }

    if (owner) {
      connect(attempt, halfOpen);
    }
    return await(attempt);
  }

  /**
   * Runs the gated attempt sequence and completes the given future.
   *
   * @param attempt  the future shared with the waiting callers
   * @param halfOpen whether the sequence is a half-open probe
   */
  private void connect(final CompletableFuture<RealtimeClient> attempt,
      final boolean halfOpen) {
    final int maxRetries = retryPolicy.maxRetries();
    RuntimeException lastError = null;

    for (int n = 1; n <= maxRetries; n++) {
      RealtimeClient candidate = null;
      try {
        candidate = createClient();
        probe(candidate);
      } catch (final RuntimeException e) {
        lastError = e;
        closeQuietly(candidate);
        synchronized (lock) {
          health = health.withFailureCount(health.failureCount() + 1);
        }
        metrics.connectionAttemptFailed(n, e);
        log.warn("Connection attempt {}/{} to {} failed: {}", n, maxRetries,
            endpoint.url(), e.getMessage());

        if (n < maxRetries) {
          final Duration delay = retryPolicy.delayAfter(n,
              jitter.getAsDouble());
          log.debug("Retrying connection in {} ms", delay.toMillis());
          try {
            sleeper.sleep(delay);
          } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Connection retry interrupted");
            break;
          }
        }
        continue;
      }

      final ConnectionHealth snapshot;
      synchronized (lock) {
        inFlight = null;
        if (destroyed) {
          closeQuietly(candidate);
          attempt.completeExceptionally(new ConnectionUnavailableException(
              "connection factory destroyed", null, null));
          return;
        }
        client = candidate;
        health = ConnectionHealth.connected(clock.instant());
        snapshot = health;
      }
      metrics.connectionEstablished(n);
      log.info("Connected to {} after {} attempt(s)", endpoint.url(), n);
      attempt.complete(candidate);
      notifyListeners(snapshot);
      return;
    }

    final ConnectionHealth snapshot;
    final ConnectionUnavailableException failure;
    synchronized (lock) {
      final Instant retryAt = clock.instant().plus(retryPolicy.maxDelay());
      final int failures = halfOpen
          ? circuitBreaker.reopenFailureCount(health.failureCount())
          : health.failureCount();
      health = health.failed(failures, retryAt);
      inFlight = null;
      snapshot = health;
      failure = new ConnectionUnavailableException(
          "connection failed after " + maxRetries + " attempt(s)"
              + (lastError == null ? "" : ": " + lastError.getMessage()),
          retryAt, lastError);
    }
    log.error("Unable to connect to {}, failureCount={}", endpoint.url(),
        snapshot.failureCount());
    attempt.completeExceptionally(failure);
    notifyListeners(snapshot);
  }

  /**
   * Waits for the outcome of an attempt.
   *
   * @param attempt the attempt, never null
   *
   * @return the connected client, never null
   */
  private RealtimeClient await(
      final CompletableFuture<RealtimeClient> attempt) {
    try {
      return attempt.get();
    } catch (final ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof ConnectionUnavailableException) {
        throw (ConnectionUnavailableException) cause;
      }
      throw new ConnectionUnavailableException("connection attempt failed",
          null, cause);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConnectionUnavailableException(
          "interrupted while waiting for connection", null, e);
    }
  }

  private RealtimeClient createClient() {
    final RealtimeClient created;
    try {
      created = clientFactory.create(endpoint);
    } catch (final ClientCreationException e) {
      throw e;
    } catch (final RuntimeException e) {
      throw new ClientCreationException(
          "Failed to create realtime client for " + endpoint.url(), e);
    }
    if (created == null) {
      throw new ClientCreationException(
          "Client factory returned null for " + endpoint.url());
    }
    return created;
  }

  /**
   * Probes the given client within the probe timeout.
   *
   * <p>Cancelling a {@link CompletableFuture} does not interrupt the worker
   * running the probe. A hung probe keeps its worker until the client is
   * closed, so callers must close the candidate when this method throws.
   *
   * @param candidate the client to probe, never null
   *
   * @throws ConnectionProbeException if the probe fails or times out
   */
  private void probe(final RealtimeClient candidate) {
    final CompletableFuture<Void> probe =
        CompletableFuture.runAsync(candidate::probe, scheduler);
    try {
      probe.get(probeTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final TimeoutException e) {
      probe.cancel(false);
      throw new ConnectionProbeException("Connectivity probe timed out after "
          + probeTimeout.toMillis() + " ms", e);
    } catch (final ExecutionException e) {
      throw new ConnectionProbeException("Connectivity probe failed: "
          + e.getCause().getMessage(), e.getCause());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConnectionProbeException("Connectivity probe interrupted", e);
    }
  }

  /**
   * Starts the background health probe. Calling it more than once has no
   * effect.
   *
   * @throws IllegalStateException if the factory was destroyed
   */
  public void startHealthChecks() {
    synchronized (lock) {
      requireNotDestroyed();
      if (healthProbe != null) {
        return;
      }
      healthProbe = scheduler.scheduleAtFixedRate("vigia-health-probe",
          this::checkHealth, healthCheckInterval, healthCheckInterval);
    }
    log.info("Health checks started, interval={} ms",
        healthCheckInterval.toMillis());
  }

  /** Probes the cached client, if any. */
  void checkHealth() {
    final RealtimeClient current;
    synchronized (lock) {
      if (destroyed || client == null) {
        return;
      }
      current = client;
    }

    try {
      probe(current);
    } catch (final ConnectionProbeException e) {
      onProbeFailure(current, e);
      return;
    }

    final ConnectionHealth snapshot;
    synchronized (lock) {
      if (client != current || (health.status() == ConnectionStatus.CONNECTED
          && health.failureCount() == 0)) {
        log.debug("Health probe succeeded");
        return;
      }
      health = ConnectionHealth.connected(clock.instant());
      snapshot = health;
    }
    log.info("Connection to {} recovered", endpoint.url());
    notifyListeners(snapshot);
  }

  private void onProbeFailure(final RealtimeClient current,
      final ConnectionProbeException error) {
    final ConnectionHealth snapshot;
    synchronized (lock) {
      if (client != current) {
        return;
      }
      client = null;
      final int failures = health.failureCount() + 1;
      final Instant retryAt = failures >= circuitBreaker.threshold()
          ? clock.instant().plus(retryPolicy.maxDelay())
          : health.nextRetryAt().orElse(null);
      health = health.degraded(failures, retryAt);
      snapshot = health;
    }
    log.warn("Health probe failed, connection degraded: {}",
        error.getMessage());
    closeQuietly(current);
    notifyListeners(snapshot);
  }

  /**
   * Registers a listener for health changes.
   *
   * @param listener the listener, never null
   */
  public void addListener(final ConnectionHealthListener listener) {
    Objects.requireNonNull(listener, "listener cannot be null");
    listeners.add(listener);
  }

  private void notifyListeners(final ConnectionHealth snapshot) {
    for (final ConnectionHealthListener listener : listeners) {
      try {
        listener.onHealthChange(snapshot);
      } catch (final Exception e) {
        log.error("Health listener threw exception", e);
      }
    }
  }

  /**
   * Returns the current health snapshot.
   *
   * @return the health, never null
   */
  public ConnectionHealth health() {
    synchronized (lock) {
      return health;
    }
  }

  /**
   * Returns the current circuit state.
   *
   * @return the circuit state, never null
   */
  public CircuitState circuitState() {
    synchronized (lock) {
      return circuitBreaker.state(health, clock.instant());
    }
  }

  /**
   * Stops the health probe, closes the cached client and clears the
   * listeners. Callers waiting on an attempt fail with
   * {@link ConnectionUnavailableException}. Calling it more than once has
   * no effect.
   */
  public void destroy() {
    final ScheduledTask task;
    final RealtimeClient cached;
    final CompletableFuture<RealtimeClient> pending;
    synchronized (lock) {
      if (destroyed) {
        return;
      }
      destroyed = true;
      task = healthProbe;
      healthProbe = null;
      cached = client;
      client = null;
      pending = inFlight;
      health = health.withStatus(ConnectionStatus.DISCONNECTED);
    }
    if (task != null) {
      task.cancel();
    }
    closeQuietly(cached);
    listeners.clear();
    if (pending != null) {
      pending.completeExceptionally(new ConnectionUnavailableException(
          "connection factory destroyed", null, null));
    }
    log.info("ConnectionFactory destroyed");
  }

  private void requireNotDestroyed() {
    if (destroyed) {
      throw new IllegalStateException("ConnectionFactory has been destroyed");
    }
  }

  private static void closeQuietly(final RealtimeClient theClient) {
    if (theClient == null) {
      return;
    }
    try {
      theClient.close();
    } catch (final Exception e) {
      log.warn("Error closing realtime client: {}", e.getMessage());
    }
  }

  /**
   * Builder for {@link ConnectionFactory}.
   *
   * <p>Options default to {@link VigiaOptions#defaults()}, metrics to
   * {@link NoopVigiaMetrics}, the clock to the system UTC clock, the
   * sleeper to {@link Sleeper#THREAD} and the jitter to
   * {@link ThreadLocalRandom}.
   */
  public static final class Builder {

    /** The realtime service, never null. */
    private final RealtimeEndpoint endpoint;

    /** Creates the underlying clients, never null. */
    private final RealtimeClientFactory clientFactory;

    /** Runs the health probe and the probe calls, never null. */
    private final TaskScheduler scheduler;

    /** The connection options. */
    private VigiaOptions options = VigiaOptions.defaults();

    /** The metrics hook. */
    private VigiaMetrics metrics = new NoopVigiaMetrics();

    /** The time source. */
    private Clock clock = Clock.systemUTC();

    /** Waits between attempts. */
    private Sleeper sleeper = Sleeper.THREAD;

    /** The backoff jitter source, values in [0, 1). */
    private DoubleSupplier jitter = () ->
        ThreadLocalRandom.current().nextDouble();

    private Builder(final RealtimeEndpoint theEndpoint,
        final RealtimeClientFactory theClientFactory,
        final TaskScheduler theScheduler) {
      endpoint = Objects.requireNonNull(theEndpoint,
          "endpoint cannot be null");
      clientFactory = Objects.requireNonNull(theClientFactory,
          "clientFactory cannot be null");
      scheduler = Objects.requireNonNull(theScheduler,
          "scheduler cannot be null");
    }

    /**
     * Sets the retry policy, breaker threshold, probe timeout and health check
     * interval.
     *
     * @param theOptions the connection options, never null
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
     * Sets the hook notified of connection attempts and circuit rejections.
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
     * Sets the clock used for backoff deadlines and health timestamps.
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
     * Builds the connection factory. Nothing connects until
     * {@link ConnectionFactory#getConnection()} is called.
     *
     * @return the factory, never null
     */
    public ConnectionFactory build() {
      return new ConnectionFactory(this);
    }
  }
}
