package org.waabox.vigia.client;

/**
 * Receives the status transitions of a {@link Channel}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ChannelStatusListener {

  /**
   * Called on every status transition.
   *
   * @param status the new status, never null
   * @param cause  the error reported by the service, may be null
   */
  void onStatus(ChannelStatus status, Throwable cause);
}
