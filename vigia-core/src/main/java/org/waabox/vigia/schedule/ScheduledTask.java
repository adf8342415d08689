package org.waabox.vigia.schedule;

/**
 * A handle to a recurring task registered with a {@link TaskScheduler}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ScheduledTask {

  /**
   * Cancels the task. A run already in progress is allowed to finish.
   * Calling it more than once has no effect.
   */
  void cancel();

  /**
   * Whether the task was cancelled.
   *
   * @return true once {@link #cancel()} was called or the scheduler was
   *         shut down
   */
  boolean isCancelled();
}
