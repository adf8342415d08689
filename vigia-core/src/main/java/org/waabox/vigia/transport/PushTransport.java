package org.waabox.vigia.transport;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.Subscription;
import org.waabox.vigia.VigiaException;
import org.waabox.vigia.client.ChangeEvent;
import org.waabox.vigia.client.Channel;
import org.waabox.vigia.client.ChannelStatus;
import org.waabox.vigia.client.RealtimeClient;
import org.waabox.vigia.connection.ConnectionFactory;
import org.waabox.vigia.connection.ConnectionUnavailableException;

/**
 * Opens a push channel per topic on the shared client.
 *
 * <p>{@link #open} blocks until the channel reports
 * {@link ChannelStatus#SUBSCRIBED} or the subscribe timeout elapses. Any
 * other first status, or the timeout, leaves the channel and fails with a
 * {@link SubscriptionOpenException}. A failure status reported after the
 * channel was subscribed notifies the {@link TransportFailureListener}
 * once, unless the handle was closed on request.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PushTransport implements Transport {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(PushTransport.class);

  /** Provides the shared client, never null. */
  private final ConnectionFactory connectionFactory;

  /** How long a channel may take to report SUBSCRIBED, never null. */
  private final Duration subscribeTimeout;

  /**
   * Creates a new push transport.
   *
   * @param theConnectionFactory provides the shared client, never null
   * @param theSubscribeTimeout  how long a channel may take to subscribe,
   *                             never null
   */
  public PushTransport(final ConnectionFactory theConnectionFactory,
      final Duration theSubscribeTimeout) {
    connectionFactory = Objects.requireNonNull(theConnectionFactory,
        "connectionFactory cannot be null");
    subscribeTimeout = Objects.requireNonNull(theSubscribeTimeout,
        "subscribeTimeout cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public TransportKind kind() {
    return TransportKind.PUSH;
  }

  /** {@inheritDoc} */
  @Override
  public TransportHandle open(final Subscription subscription,
      final TransportFailureListener failureListener) {
    Objects.requireNonNull(subscription, "subscription cannot be null");
    Objects.requireNonNull(failureListener,
        "failureListener cannot be null");

    final String key = subscription.key();
    final RealtimeClient client;
    try {
      client = connectionFactory.getConnection();
    } catch (final ConnectionUnavailableException e) {
      throw new SubscriptionOpenException(key,
          "connection unavailable: " + e.reason(), e);
    }

    final PushHandle handle = new PushHandle(subscription, failureListener);
    try {
      final Channel channel = client.openChannel(key);
      handle.attach(channel);
      channel.onChange(subscription.resource(), handle::onEvent);
      channel.subscribe(handle::onStatus);
    } catch (final RuntimeException e) {
      handle.close();
      throw new SubscriptionOpenException(key, "cannot open channel: "
          + e.getMessage(), e);
    }

    handle.awaitSubscribed(subscribeTimeout);
    log.debug("Push channel subscribed for topic '{}'", key);
    return handle;
  }

  /** The handle of one push channel. */
  private static final class PushHandle implements TransportHandle {

    private final Subscription subscription;

    private final TransportFailureListener failureListener;

    /** Completed with the first status the channel reports. */
    private final CompletableFuture<ChannelStatus> firstStatus =
        new CompletableFuture<>();

    private final AtomicBoolean active = new AtomicBoolean(false);

    private final AtomicBoolean closed = new AtomicBoolean(false);

    /** The failure reported after subscription, null while healthy. */
    private final AtomicReference<VigiaException> failure =
        new AtomicReference<>();

    private volatile Channel channel;

    /** The cause reported with the first status, may be null. */
    private volatile Throwable firstCause;

    PushHandle(final Subscription theSubscription,
        final TransportFailureListener theFailureListener) {
      subscription = theSubscription;
      failureListener = theFailureListener;
    }

    void attach(final Channel theChannel) {
      channel = theChannel;
    }

    void onEvent(final ChangeEvent event) {
      if (active.get() && !closed.get()) {
        subscription.deliver(event);
      } else {
        log.debug("Dropping event for inactive push handle of topic '{}'",
            subscription.key());
      }
    }

    void onStatus(final ChannelStatus status, final Throwable cause) {
      if (!firstStatus.isDone()) {
        firstCause = cause;
        if (firstStatus.complete(status)) {
          return;
        }
      }
      if (!status.isFailure() || closed.get()) {
        return;
      }
      final VigiaException error = new SubscriptionOpenException(
          subscription.key(), "channel reported " + status, cause);
      if (failure.compareAndSet(null, error)) {
        log.warn("Push channel for topic '{}' reported {}",
            subscription.key(), status);
        failureListener.onTransportFailure(this, error);
      }
    }

    void awaitSubscribed(final Duration timeout) {
      ChannelStatus status;
      try {
        status = firstStatus.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (final TimeoutException e) {
        status = ChannelStatus.TIMED_OUT;
      } catch (final ExecutionException e) {
        close();
        throw new SubscriptionOpenException(subscription.key(),
            "channel subscription failed", e.getCause());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        close();
        throw new SubscriptionOpenException(subscription.key(),
            "interrupted while subscribing", e);
      }
      if (status != ChannelStatus.SUBSCRIBED) {
        close();
        throw new SubscriptionOpenException(subscription.key(),
            "channel reported " + status, firstCause);
      }
    }

    @Override
    public TransportKind kind() {
      return TransportKind.PUSH;
    }

    @Override
    public Optional<VigiaException> failure() {
      return Optional.ofNullable(failure.get());
    }

    @Override
    public void activate() {
      if (!closed.get()) {
        active.set(true);
      }
    }

    @Override
    public void close() {
      if (!closed.compareAndSet(false, true)) {
        return;
      }
      active.set(false);
      final Channel current = channel;
      if (current == null) {
        return;
      }
      try {
        current.unsubscribe();
      } catch (final Exception e) {
        log.warn("Error leaving push channel of topic '{}': {}",
            subscription.key(), e.getMessage());
      }
    }
  }
}
