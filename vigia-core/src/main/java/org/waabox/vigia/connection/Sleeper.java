package org.waabox.vigia.connection;

import java.time.Duration;

/**
 * Waits between connection attempts.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface Sleeper {

  /** Sleeps on the calling thread. */
  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  /**
   * Waits for the given duration.
   *
   * @param duration the duration, never null
   *
   * @throws InterruptedException if the wait is interrupted
   */
  void sleep(Duration duration) throws InterruptedException;
}
