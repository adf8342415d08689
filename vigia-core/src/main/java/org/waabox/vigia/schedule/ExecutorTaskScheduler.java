package org.waabox.vigia.schedule;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link TaskScheduler} backed by JDK executors.
 *
 * <p>Recurring tasks run on a small scheduled pool; one-off work runs on
 * a cached pool so a blocking probe never delays a timer. All threads are
 * daemons.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ExecutorTaskScheduler implements TaskScheduler {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ExecutorTaskScheduler.class);

  /** Default size of the timer pool. */
  private static final int DEFAULT_TIMER_THREADS = 2;

  /** Runs the recurring tasks. */
  private final ScheduledExecutorService timers;

  /** Runs the one-off tasks. */
  private final ExecutorService workers;

  /** Creates a scheduler with the default timer pool size. */
  public ExecutorTaskScheduler() {
    this(DEFAULT_TIMER_THREADS);
  }

  /**
   * Creates a scheduler.
   *
   * @param timerThreads the size of the timer pool, must be positive
   */
  public ExecutorTaskScheduler(final int timerThreads) {
    if (timerThreads <= 0) {
      throw new IllegalArgumentException(
          "timerThreads must be greater than 0, got: " + timerThreads);
    }
    timers = Executors.newScheduledThreadPool(timerThreads,
        daemonFactory("vigia-timer-"));
    workers = Executors.newCachedThreadPool(daemonFactory("vigia-worker-"));
  }

  /** {@inheritDoc} */
  @Override
  public ScheduledTask scheduleAtFixedRate(final String name,
      final Runnable task, final Duration initialDelay,
      final Duration period) {
    Objects.requireNonNull(name, "name cannot be null");
    Objects.requireNonNull(task, "task cannot be null");
    Objects.requireNonNull(initialDelay, "initialDelay cannot be null");
    Objects.requireNonNull(period, "period cannot be null");

    // An exception escaping a fixed-rate task suppresses later runs.
    final Runnable guarded = () -> {
      try {
        task.run();
      } catch (final Exception e) {
        log.error("Scheduled task '{}' failed", name, e);
      }
    };

    final ScheduledFuture<?> future = timers.scheduleAtFixedRate(guarded,
        initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);

    log.debug("Scheduled task '{}' every {} ms", name, period.toMillis());

    return new ScheduledTask() {
      @Override
      public void cancel() {
        future.cancel(false);
      }

      @Override
      public boolean isCancelled() {
        return future.isCancelled();
      }
    };
  }

  /** {@inheritDoc} */
  @Override
  public void execute(final Runnable task) {
    Objects.requireNonNull(task, "task cannot be null");
    workers.execute(task);
  }

  /** {@inheritDoc} */
  @Override
  public void shutdown() {
    timers.shutdownNow();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        workers.shutdownNow();
      }
    } catch (final InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
    log.debug("ExecutorTaskScheduler stopped");
  }

  /**
   * Creates a thread factory producing named daemon threads.
   *
   * @param prefix the thread name prefix, never null
   *
   * @return the thread factory, never null
   */
  private static ThreadFactory daemonFactory(final String prefix) {
    final AtomicInteger counter = new AtomicInteger();
    return r -> {
      final Thread thread = new Thread(r, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
