package org.waabox.vigia.testing;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.waabox.vigia.schedule.ScheduledTask;
import org.waabox.vigia.schedule.TaskScheduler;

/**
 * A {@link TaskScheduler} driven by hand.
 *
 * <p>One-off tasks run inline on the calling thread. Recurring tasks only
 * run when a test fires them, and the scheduler counts the ones still
 * live.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ManualTaskScheduler implements TaskScheduler {

  private final List<ManualTask> tasks = new CopyOnWriteArrayList<>();

  private volatile boolean shutdown;

  @Override
  public ScheduledTask scheduleAtFixedRate(final String name,
      final Runnable task, final Duration initialDelay,
      final Duration period) {
    final ManualTask scheduled = new ManualTask(name, task, period);
    tasks.add(scheduled);
    return scheduled;
  }

  @Override
  public void execute(final Runnable task) {
    task.run();
  }

  @Override
  public void shutdown() {
    shutdown = true;
    tasks.forEach(ManualTask::cancel);
  }

  /**
   * Runs once every live task whose name starts with the given prefix.
   *
   * @param prefix the name prefix
   *
   * @return how many tasks ran
   */
  public int fire(final String prefix) {
    int ran = 0;
    for (final ManualTask task : new ArrayList<>(tasks)) {
      if (!task.isCancelled() && task.name().startsWith(prefix)) {
        task.runnable().run();
        ran++;
      }
    }
    return ran;
  }

  /**
   * Counts the live tasks whose name starts with the given prefix.
   *
   * @param prefix the name prefix
   *
   * @return the live task count
   */
  public long liveTasks(final String prefix) {
    return tasks.stream()
        .filter(task -> !task.isCancelled())
        .filter(task -> task.name().startsWith(prefix))
        .count();
  }

  /**
   * Counts every live task.
   *
   * @return the live task count
   */
  public long liveTasks() {
    return liveTasks("");
  }

  /**
   * Returns the period of the first live task with the given prefix.
   *
   * @param prefix the name prefix
   *
   * @return the period, null if there is no such task
   */
  public Duration periodOf(final String prefix) {
    return tasks.stream()
        .filter(task -> !task.isCancelled())
        .filter(task -> task.name().startsWith(prefix))
        .map(ManualTask::period)
        .findFirst()
        .orElse(null);
  }

  public boolean isShutdown() {
    return shutdown;
  }

  /** A recurring task registered by the code under test. */
  private static final class ManualTask implements ScheduledTask {

    private final String name;
    private final Runnable runnable;
    private final Duration period;
    private volatile boolean cancelled;

    ManualTask(final String theName, final Runnable theRunnable,
        final Duration thePeriod) {
      name = theName;
      runnable = theRunnable;
      period = thePeriod;
    }

    String name() {
      return name;
    }

    Runnable runnable() {
      return runnable;
    }

    Duration period() {
      return period;
    }

    @Override
    public void cancel() {
      cancelled = true;
    }

    @Override
    public boolean isCancelled() {
      return cancelled;
    }
  }
}
