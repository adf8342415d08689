package org.waabox.vigia.schedule;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ExecutorTaskScheduler}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ExecutorTaskSchedulerTest {

  @Test
  void whenTaskThrows_shouldKeepRunningIt() throws Exception {
    final ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler();
    final CountDownLatch runs = new CountDownLatch(3);
    try {
      scheduler.scheduleAtFixedRate("failing", () -> {
        runs.countDown();
        throw new IllegalStateException("boom");
      }, Duration.ZERO, Duration.ofMillis(10));

      assertTrue(runs.await(5, TimeUnit.SECONDS));
    } finally {
      scheduler.shutdown();
    }
  }

  @Test
  void whenCancelled_shouldStopRunning() throws Exception {
    final ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler();
    final AtomicInteger runs = new AtomicInteger();
    try {
      final ScheduledTask task = scheduler.scheduleAtFixedRate("counter",
          runs::incrementAndGet, Duration.ZERO, Duration.ofMillis(10));
      Thread.sleep(50);

      task.cancel();
      final int afterCancel = runs.get();
      Thread.sleep(50);

      assertTrue(task.isCancelled());
      assertTrue(runs.get() <= afterCancel + 1);
    } finally {
      scheduler.shutdown();
    }
  }

  @Test
  void whenExecuting_shouldRunOnWorkerThread() throws Exception {
    final ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler();
    final CountDownLatch ran = new CountDownLatch(1);
    final String[] threadName = new String[1];
    try {
      scheduler.execute(() -> {
        threadName[0] = Thread.currentThread().getName();
        ran.countDown();
      });

      assertTrue(ran.await(5, TimeUnit.SECONDS));
      assertTrue(threadName[0].startsWith("vigia-worker-"));
    } finally {
      scheduler.shutdown();
    }
  }
}
