package org.waabox.vigia.client;

/**
 * A named push channel on a {@link RealtimeClient}.
 *
 * <p>Typical lifecycle:
 * <ol>
 *   <li>Register change listeners via
 *       {@link #onChange(Resource, ChangeListener)}</li>
 *   <li>Call {@link #subscribe(ChannelStatusListener)} to join the
 *       channel; the status listener reports {@link ChannelStatus}
 *       transitions asynchronously</li>
 *   <li>Call {@link #unsubscribe()} to leave the channel</li>
 * </ol>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface Channel {

  /**
   * Listens for row-level change events on the given resource.
   *
   * @param resource the resource to listen to, never null
   * @param listener the listener that receives the events, never null
   *
   * @return this channel for chaining, never null
   */
  Channel onChange(Resource resource, ChangeListener listener);

  /**
   * Joins the channel.
   *
   * @param statusListener notified of every status transition, never null
   */
  void subscribe(ChannelStatusListener statusListener);

  /** Leaves the channel. Calling it more than once has no effect. */
  void unsubscribe();
}
