package org.waabox.vigia.transport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.Subscription;
import org.waabox.vigia.client.ChangeEvent;
import org.waabox.vigia.connection.ConnectionFactory;
import org.waabox.vigia.metrics.VigiaMetrics;
import org.waabox.vigia.schedule.ScheduledTask;
import org.waabox.vigia.schedule.TaskScheduler;

/**
 * Periodically queries each topic's resource through the shared client.
 *
 * <p>An activated handle polls once right away and then at a fixed rate.
 * Each tick fingerprints the rows and, only when the fingerprint differs
 * from the last one, replaces the snapshot and emits an UPDATE event
 * carrying the first row. The first successful tick always emits because
 * there is no snapshot yet. A failed tick reports a
 * {@link PollQueryException} to the topic and the timer keeps running.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PollTransport implements Transport {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(PollTransport.class);

  /** Provides the shared client, never null. */
  private final ConnectionFactory connectionFactory;

  /** Runs the poll timers, never null. */
  private final TaskScheduler scheduler;

  /** The interval between ticks, never null. */
  private final Duration interval;

  /** The metrics hook, never null. */
  private final VigiaMetrics metrics;

  /** The time source, never null. */
  private final Clock clock;

  /**
   * Creates a new poll transport.
   *
   * @param theConnectionFactory provides the shared client, never null
   * @param theScheduler         runs the poll timers, never null
   * @param theInterval          the interval between ticks, never null
   * @param theMetrics           the metrics hook, never null
   * @param theClock             the time source, never null
   */
  public PollTransport(final ConnectionFactory theConnectionFactory,
      final TaskScheduler theScheduler, final Duration theInterval,
      final VigiaMetrics theMetrics, final Clock theClock) {
    connectionFactory = Objects.requireNonNull(theConnectionFactory,
        "connectionFactory cannot be null");
    scheduler = Objects.requireNonNull(theScheduler,
        "scheduler cannot be null");
    interval = Objects.requireNonNull(theInterval,
        "interval cannot be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics cannot be null");
    clock = Objects.requireNonNull(theClock, "clock cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public TransportKind kind() {
    return TransportKind.POLL;
  }

  /**
   * Creates the poll handle of a topic. Polling starts on
   * {@link TransportHandle#activate()}; poll handles never notify the
   * failure listener.
   */
  @Override
  public TransportHandle open(final Subscription subscription,
      final TransportFailureListener failureListener) {
    Objects.requireNonNull(subscription, "subscription cannot be null");
    return new PollHandle(subscription);
  }

  /** The handle of one polled topic. */
  private final class PollHandle implements TransportHandle {

    private final Subscription subscription;

    /** Serializes ticks so events are emitted in poll order. */
    private final Object pollLock = new Object();

    /**
     * Guards closed, task and snapshot. Held while a change is delivered,
     * never during the query, so close() returns only after any delivery
     * in progress ended.
     */
    private final Object stateLock = new Object();

    /** The last observed rows, null before the first successful tick. */
    private PollSnapshot snapshot;

    /** The poll timer, null until activated. */
    private ScheduledTask task;

    private volatile boolean closed;

    PollHandle(final Subscription theSubscription) {
      subscription = theSubscription;
    }

    @Override
    public TransportKind kind() {
      return TransportKind.POLL;
    }

    @Override
    public void activate() {
      synchronized (stateLock) {
        if (closed || task != null) {
          return;
        }
        task = scheduler.scheduleAtFixedRate(
            "vigia-poll-" + subscription.key(), this::poll, interval,
            interval);
      }
      log.info("Polling topic '{}' every {} ms", subscription.key(),
          interval.toMillis());
      poll();
    }

    private void poll() {
      synchronized (pollLock) {
        if (closed) {
          return;
        }
        final String key = subscription.key();
        final List<Map<String, Object>> rows;
        final String fingerprint;
        try {
          rows = connectionFactory.getConnection()
              .query(subscription.resource());
          fingerprint = RowsFingerprint.of(rows);
        } catch (final RuntimeException e) {
          if (closed) {
            log.debug("Ignoring poll failure of closed topic '{}'", key);
            return;
          }
          metrics.pollFailed(key, e);
          log.warn("Poll of topic '{}' failed: {}", key, e.getMessage());
          subscription.reportError(new PollQueryException(key,
              "poll failed: " + e.getMessage(), e));
          return;
        }

        synchronized (stateLock) {
          // The handle may have been closed while the query ran.
          if (closed) {
            log.debug("Discarding poll result of closed topic '{}'", key);
            return;
          }
          if (snapshot != null && snapshot.sameAs(fingerprint)) {
            log.debug("No changes for topic '{}'", key);
            return;
          }

          final Instant now = clock.instant();
          snapshot = new PollSnapshot(rows, fingerprint, now);
          final Map<String, Object> latest =
              rows.isEmpty() ? null : rows.get(0);
          log.debug("Rows changed for topic '{}', {} row(s)", key,
              rows.size());
          subscription.deliver(ChangeEvent.polledUpdate(
              subscription.resource(), latest, now));
        }
      }
    }

    /**
     * Stops polling. Returns once any delivery in progress ended; the
     * result of a query still running is discarded when it returns.
     */
    @Override
    public void close() {
      final ScheduledTask current;
      synchronized (stateLock) {
        if (closed) {
          return;
        }
        closed = true;
        current = task;
        task = null;
        snapshot = null;
      }
      if (current != null) {
        current.cancel();
      }
      log.debug("Stopped polling topic '{}'", subscription.key());
    }
  }
}
