package org.waabox.vigia.schedule;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Runs the timers and background work of a Vigia instance: poll ticks,
 * health probes, reconnection ticks, probe timeouts and registry events.
 *
 * <p>Every timer Vigia creates goes through this interface, so a test
 * double can drive time by hand and count live timers.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface TaskScheduler extends Executor {

  /**
   * Schedules a task at a fixed rate.
   *
   * @param name         a short name used for logging, never null
   * @param task         the task to run, never null
   * @param initialDelay the delay before the first run, never null
   * @param period       the period between runs, never null
   *
   * @return the task handle, never null
   */
  ScheduledTask scheduleAtFixedRate(String name, Runnable task,
      Duration initialDelay, Duration period);

  /**
   * Runs a one-off task asynchronously.
   *
   * @param task the task, never null
   */
  @Override
  void execute(Runnable task);

  /** Cancels every scheduled task and releases the worker threads. */
  void shutdown();
}
