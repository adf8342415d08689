package org.waabox.vigia.subscription;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.Subscription;
import org.waabox.vigia.VigiaException;
import org.waabox.vigia.connection.ConnectionFactory;
import org.waabox.vigia.connection.ConnectionHealth;
import org.waabox.vigia.connection.ConnectionStatus;
import org.waabox.vigia.metrics.VigiaMetrics;
import org.waabox.vigia.schedule.TaskScheduler;
import org.waabox.vigia.transport.SubscriptionOpenException;
import org.waabox.vigia.transport.Transport;
import org.waabox.vigia.transport.TransportHandle;
import org.waabox.vigia.transport.TransportKind;

/**
 * Keeps one delivery handle per topic and moves topics between push and
 * poll.
 *
 * <p>A new subscription tries push first. When push cannot be opened the
 * error is reported to the topic, the topic falls back to poll (or stays
 * pending if polling is disabled) and the {@link ReconnectionScheduler}
 * is started. A push channel that drops later, or a degraded connection
 * health, triggers the same fallback.
 *
 * <p>Registry state is guarded by a single lock. Handles are opened and
 * closed outside the lock; a handle opened by an operation that lost a
 * race with another one (an unsubscribe, a replacing subscribe, a
 * concurrent fallback) is closed instead of installed. The previous
 * handle of a topic is always closed before the new one is activated.
 * Failures of one topic never affect the others.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SubscriptionRegistry {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SubscriptionRegistry.class);

  /** Opens the push handles, never null. */
  private final Transport push;

  /** Opens the poll handles, never null. */
  private final Transport poll;

  /** Whether topics that lost push fall back to poll or stay pending. */
  private final boolean pollingEnabled;

  /** Runs failovers triggered by channel drops and health changes. */
  private final Executor events;

  /** Notified of every transport activation, never null. */
  private final VigiaMetrics metrics;

  /** Brings topics back to push, never null. */
  private final ReconnectionScheduler reconnection;

  /** Guards topics and destroyed. */
  private final Object lock = new Object();

  /** The topics by key, in subscription order. */
  private final Map<String, TopicState> topics = new LinkedHashMap<>();

  /** Whether destroy() has been called. */
  private boolean destroyed;

  /**
   * Creates a new registry.
   *
   * <p>The registry listens to the health of the given connection
   * factory and falls back every push topic when it degrades.
   *
   * @param thePush                 the push transport, never null
   * @param thePoll                 the poll transport, never null
   * @param theConnectionFactory    the shared connection, never null
   * @param theScheduler            runs the reconnection timer and the
   *                                failover events, never null
   * @param theReconnectionInterval the interval between reconnection
   *                                ticks, never null
   * @param thePollingEnabled       whether topics fall back to poll
   * @param theMetrics              the metrics hook, never null
   */
  public SubscriptionRegistry(final Transport thePush, final Transport thePoll,
      final ConnectionFactory theConnectionFactory,
      final TaskScheduler theScheduler,
      final Duration theReconnectionInterval,
      final boolean thePollingEnabled, final VigiaMetrics theMetrics) {
    push = Objects.requireNonNull(thePush, "push cannot be null");
    poll = Objects.requireNonNull(thePoll, "poll cannot be null");
    Objects.requireNonNull(theConnectionFactory,
        "connectionFactory cannot be null");
    events = Objects.requireNonNull(theScheduler, "scheduler cannot be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics cannot be null");
    pollingEnabled = thePollingEnabled;
    reconnection = new ReconnectionScheduler(this, theConnectionFactory,
        theScheduler, theReconnectionInterval);
    theConnectionFactory.addListener(this::onHealthChange);
  }

  /**
   * Subscribes a topic, replacing any previous subscription with the same
   * key. Never throws because of transport failures; those are reported
   * to the subscription's error listener.
   *
   * @param subscription the subscription, never null
   *
   * @throws IllegalStateException if the registry was destroyed
   */
  public void subscribe(final Subscription subscription) {
    Objects.requireNonNull(subscription, "subscription cannot be null");

    final TopicState state = new TopicState(subscription);
    final TopicState replaced;
    final TransportHandle previous;
    final long epoch;
    synchronized (lock) {
      if (destroyed) {
        throw new IllegalStateException("SubscriptionRegistry destroyed");
      }
      replaced = topics.put(subscription.key(), state);
      previous = replaced == null ? null : replaced.detach();
      epoch = state.epoch();
    }
    closeQuietly(previous);
    log.info("Subscribing topic '{}' to {}{}", subscription.key(),
        subscription.resource(), replaced == null ? "" : " (replaced)");

    try {
      install(state, epoch, push);
      return;
    } catch (final SubscriptionOpenException e) {
      log.warn("Push unavailable for topic '{}': {}", subscription.key(),
          e.getMessage());
      subscription.reportError(e);
    }
    degrade(state, epoch);
  }

  /**
   * Unsubscribes a topic and closes its handle. Unknown keys are ignored.
   *
   * @param key the topic key, never null
   */
  public void unsubscribe(final String key) {
    Objects.requireNonNull(key, "key cannot be null");
    final TransportHandle handle;
    synchronized (lock) {
      final TopicState state = topics.remove(key);
      if (state == null) {
        return;
      }
      handle = state.detach();
    }
    closeQuietly(handle);
    log.info("Unsubscribed topic '{}'", key);
  }

  /**
   * Returns a point-in-time view of the registry.
   *
   * @return the status, never null
   */
  public RegistryStatus status() {
    int onPush = 0;
    int onPoll = 0;
    int total;
    synchronized (lock) {
      total = topics.size();
      for (final TopicState state : topics.values()) {
        if (state.isOn(TransportKind.PUSH)) {
          onPush++;
        } else if (state.isOn(TransportKind.POLL)) {
          onPoll++;
        }
      }
    }
    final SyncMode mode;
    if (total == 0) {
      mode = SyncMode.IDLE;
    } else if (onPush == total) {
      mode = SyncMode.REALTIME;
    } else {
      mode = SyncMode.DEGRADED;
    }
    return new RegistryStatus(mode, total, onPush, onPoll,
        total - onPush - onPoll);
  }

  /**
   * Returns the keys of the topics that are not on push.
   *
   * @return the keys, never null
   */
  List<String> pushCandidates() {
    final List<String> keys = new ArrayList<>();
    synchronized (lock) {
      if (destroyed) {
        return keys;
      }
      for (final Map.Entry<String, TopicState> entry : topics.entrySet()) {
        if (!entry.getValue().isOn(TransportKind.PUSH)) {
          keys.add(entry.getKey());
        }
      }
    }
    return keys;
  }

  /**
   * Tries to move a topic back to push.
   *
   * @param key the topic key, never null
   *
   * @return true if the topic was moved to push
   */
  boolean promoteToPush(final String key) {
    final TopicState state;
    final long epoch;
    synchronized (lock) {
      state = topics.get(key);
      if (destroyed || state == null || state.isOn(TransportKind.PUSH)) {
        return false;
      }
      epoch = state.epoch();
    }
    try {
      return install(state, epoch, push);
    } catch (final SubscriptionOpenException e) {
      log.debug("Topic '{}' still cannot use push: {}", key, e.getMessage());
      return false;
    }
  }

  /**
   * Opens a handle and installs it if the topic did not change since the
   * given epoch. The previous handle is closed before the new one is
   * activated.
   *
   * @return true if installed, false if the handle lost a race
   *
   * @throws SubscriptionOpenException if the handle cannot be opened
   */
  private boolean install(final TopicState state, final long expectedEpoch,
      final Transport transport) {
    final String key = state.subscription().key();
    final TransportHandle handle = transport.open(state.subscription(),
        this::onTransportFailure);

    TransportHandle previous = null;
    boolean current;
    synchronized (lock) {
      current = !destroyed && topics.get(key) == state
          && state.epoch() == expectedEpoch;
      if (current) {
        previous = state.install(handle);
      }
    }
    if (!current) {
      log.debug("Discarding {} handle of topic '{}', topic changed",
          transport.kind(), key);
      closeQuietly(handle);
      return false;
    }

    closeQuietly(previous);
    handle.activate();
    metrics.transportActivated(key, transport.kind());
    log.info("Topic '{}' now on {}", key, transport.kind());

    // A failure reported before the install found no topic to fall back.
    final Optional<VigiaException> failure = handle.failure();
    if (failure.isPresent()) {
      state.subscription().reportError(failure.get());
      fallback(state, handle);
    }
    return true;
  }

  /**
   * Moves a topic without transport to poll, if enabled, and makes sure
   * the reconnection scheduler runs.
   */
  private void degrade(final TopicState state, final long epoch) {
    if (pollingEnabled) {
      try {
        install(state, epoch, poll);
      } catch (final SubscriptionOpenException e) {
        log.warn("Cannot poll topic '{}': {}", state.subscription().key(),
            e.getMessage());
        state.subscription().reportError(e);
      }
    } else {
      log.info("Polling disabled, topic '{}' waits for push",
          state.subscription().key());
    }
    reconnection.ensureScheduled();
  }

  /**
   * Falls back a topic whose handle failed. Has no effect if the handle is
   * no longer the topic's active one.
   */
  private void fallback(final TopicState state,
      final TransportHandle failed) {
    final long epoch;
    synchronized (lock) {
      if (destroyed || topics.get(state.subscription().key()) != state
          || state.handle() != failed) {
        return;
      }
      state.detach();
      epoch = state.epoch();
    }
    closeQuietly(failed);
    log.warn("Topic '{}' lost its {} transport, falling back",
        state.subscription().key(), failed.kind());
    degrade(state, epoch);
  }

  private void onTransportFailure(final TransportHandle handle,
      final VigiaException cause) {
    final TopicState state = findByHandle(handle);
    if (state == null) {
      return;
    }
    events.execute(() -> {
      state.subscription().reportError(cause);
      fallback(state, handle);
    });
  }

  private void onHealthChange(final ConnectionHealth health) {
    if (health.status() != ConnectionStatus.POLLING) {
      return;
    }
    final Map<TopicState, TransportHandle> affected = new LinkedHashMap<>();
    synchronized (lock) {
      if (destroyed) {
        return;
      }
      for (final TopicState state : topics.values()) {
        if (state.isOn(TransportKind.PUSH)) {
          affected.put(state, state.handle());
        }
      }
    }
    if (!affected.isEmpty()) {
      log.warn("Connection degraded, moving {} push topic(s) to fallback",
          affected.size());
    }
    affected.forEach((state, handle) ->
        events.execute(() -> fallback(state, handle)));
  }

  private TopicState findByHandle(final TransportHandle handle) {
    synchronized (lock) {
      for (final TopicState state : topics.values()) {
        if (state.handle() == handle) {
          return state;
        }
      }
    }
    return null;
  }

  /**
   * Returns the reconnection scheduler of this registry.
   *
   * @return the reconnection scheduler, never null
   */
  public ReconnectionScheduler reconnectionScheduler() {
    return reconnection;
  }

  /**
   * Stops the reconnection scheduler and closes every handle. Calling it
   * more than once has no effect.
   */
  public void destroy() {
    final List<TransportHandle> handles = new ArrayList<>();
    synchronized (lock) {
      if (destroyed) {
        return;
      }
      destroyed = true;
      for (final TopicState state : topics.values()) {
        final TransportHandle handle = state.detach();
        if (handle != null) {
          handles.add(handle);
        }
      }
      topics.clear();
    }
    reconnection.stop();
    handles.forEach(SubscriptionRegistry::closeQuietly);
    log.info("SubscriptionRegistry destroyed, closed {} handle(s)",
        handles.size());
  }

  private static void closeQuietly(final TransportHandle handle) {
    if (handle == null) {
      return;
    }
    try {
      handle.close();
    } catch (final Exception e) {
      log.warn("Error closing {} handle: {}", handle.kind(), e.getMessage());
    }
  }
}
