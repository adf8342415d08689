package org.waabox.vigia.transport;

import org.waabox.vigia.Subscription;

/**
 * Opens delivery handles for subscriptions.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface Transport {

  /**
   * Returns the kind of handles this transport opens.
   *
   * @return the kind, never null
   */
  TransportKind kind();

  /**
   * Opens a handle for the given subscription. The handle is not active
   * until {@link TransportHandle#activate()} is called.
   *
   * @param subscription    the subscription, never null
   * @param failureListener notified when the handle fails after it was
   *                        opened, never null
   *
   * @return the opened handle, never null
   *
   * @throws SubscriptionOpenException if the handle cannot be opened
   */
  TransportHandle open(Subscription subscription,
      TransportFailureListener failureListener);
}
