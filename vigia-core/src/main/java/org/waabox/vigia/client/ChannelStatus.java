package org.waabox.vigia.client;

/**
 * Status transitions reported by a {@link Channel}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ChannelStatus {

  /** The channel joined and is streaming events. */
  SUBSCRIBED,

  /** The service rejected or dropped the channel. */
  CHANNEL_ERROR,

  /** The service did not acknowledge the channel in time. */
  TIMED_OUT,

  /** The channel was closed. */
  CLOSED;

  /**
   * Whether this status means the channel can no longer deliver events.
   *
   * @return true for every status except {@link #SUBSCRIBED}
   */
  public boolean isFailure() {
    return this != SUBSCRIBED;
  }
}
