package org.waabox.vigia.subscription;

import org.waabox.vigia.Subscription;
import org.waabox.vigia.transport.TransportHandle;
import org.waabox.vigia.transport.TransportKind;

/**
 * The registry's record of one topic: its subscription and its single
 * active handle.
 *
 * <p>Every change of handle bumps the epoch. An operation that opened a
 * handle outside the registry lock installs it only if the epoch it
 * started from is still current. Instances are only read and written
 * while holding the registry lock.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class TopicState {

  private final Subscription subscription;

  /** The active handle, null while the topic has no transport. */
  private TransportHandle handle;

  private long epoch;

  TopicState(final Subscription theSubscription) {
    subscription = theSubscription;
  }

  Subscription subscription() {
    return subscription;
  }

  TransportHandle handle() {
    return handle;
  }

  long epoch() {
    return epoch;
  }

  boolean isOn(final TransportKind kind) {
    return handle != null && handle.kind() == kind;
  }

  /**
   * Replaces the active handle.
   *
   * @param newHandle the new handle, never null
   *
   * @return the previous handle, to be closed by the caller, may be null
   */
  TransportHandle install(final TransportHandle newHandle) {
    final TransportHandle previous = handle;
    handle = newHandle;
    epoch++;
    return previous;
  }

  /**
   * Removes the active handle.
   *
   * @return the removed handle, to be closed by the caller, may be null
   */
  TransportHandle detach() {
    final TransportHandle previous = handle;
    handle = null;
    epoch++;
    return previous;
  }
}
