package org.waabox.vigia.subscription;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.connection.ConnectionFactory;
import org.waabox.vigia.connection.ConnectionUnavailableException;
import org.waabox.vigia.schedule.ScheduledTask;
import org.waabox.vigia.schedule.TaskScheduler;

/**
 * Brings topics back to push while any topic is polling or pending.
 *
 * <p>Each tick asks the connection factory for the shared client. When
 * the connection is unavailable the tick does nothing. Otherwise it tries
 * to reopen push for every topic that is not on push; topics that still
 * fail keep their current transport until the next tick. The timer stops
 * itself once every topic is on push.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ReconnectionScheduler {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ReconnectionScheduler.class);

  private final SubscriptionRegistry registry;

  private final ConnectionFactory connectionFactory;

  private final TaskScheduler scheduler;

  private final Duration interval;

  /** Guards task and stopped. */
  private final Object lock = new Object();

  /** The running timer, null when idle. */
  private ScheduledTask task;

  private boolean stopped;

  ReconnectionScheduler(final SubscriptionRegistry theRegistry,
      final ConnectionFactory theConnectionFactory,
      final TaskScheduler theScheduler, final Duration theInterval) {
    registry = theRegistry;
    connectionFactory = Objects.requireNonNull(theConnectionFactory,
        "connectionFactory cannot be null");
    scheduler = Objects.requireNonNull(theScheduler,
        "scheduler cannot be null");
    interval = Objects.requireNonNull(theInterval,
        "interval cannot be null");
  }

  /** Starts the timer unless it is already running or was stopped. */
  public void ensureScheduled() {
    synchronized (lock) {
      if (stopped || task != null) {
        return;
      }
      task = scheduler.scheduleAtFixedRate("vigia-reconnection", this::tick,
          interval, interval);
    }
    log.info("Reconnection scheduled every {} ms", interval.toMillis());
  }

  /** Runs one reconnection attempt. */
  void tick() {
    final List<String> candidates = registry.pushCandidates();
    if (candidates.isEmpty()) {
      cancelIfIdle();
      return;
    }

    try {
      connectionFactory.getConnection();
    } catch (final ConnectionUnavailableException e) {
      log.debug("Reconnection skipped: {}", e.getMessage());
      return;
    }

    int promoted = 0;
    for (final String key : candidates) {
      if (registry.promoteToPush(key)) {
        promoted++;
      }
    }
    log.info("Reconnection restored push for {} of {} topic(s)", promoted,
        candidates.size());
    cancelIfIdle();
  }

  /** Cancels the timer if no topic needs push anymore. */
  private void cancelIfIdle() {
    final ScheduledTask current;
    synchronized (lock) {
      if (task == null || !registry.pushCandidates().isEmpty()) {
        return;
      }
      current = task;
      task = null;
    }
    current.cancel();
    log.info("All topics on push, reconnection stopped");
  }

  /**
   * Whether the timer is running.
   *
   * @return true while scheduled
   */
  public boolean isScheduled() {
    synchronized (lock) {
      return task != null;
    }
  }

  /** Cancels the timer for good. */
  public void stop() {
    final ScheduledTask current;
    synchronized (lock) {
      stopped = true;
      current = task;
      task = null;
    }
    if (current != null) {
      current.cancel();
    }
  }
}
