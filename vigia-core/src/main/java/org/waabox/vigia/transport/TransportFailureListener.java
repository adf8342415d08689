package org.waabox.vigia.transport;

import org.waabox.vigia.VigiaException;

/**
 * Notified when an opened handle stops delivering on its own, for example
 * when the service drops a push channel.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface TransportFailureListener {

  /**
   * Called once per failed handle.
   *
   * @param handle the failed handle, never null
   * @param cause  the failure, never null
   */
  void onTransportFailure(TransportHandle handle, VigiaException cause);
}
