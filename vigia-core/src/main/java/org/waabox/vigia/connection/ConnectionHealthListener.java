package org.waabox.vigia.connection;

/**
 * A listener notified when the shared connection changes status.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ConnectionHealthListener {

  /**
   * Called after the connection status changed to
   * {@link ConnectionStatus#CONNECTED}, {@link ConnectionStatus#FAILED} or
   * {@link ConnectionStatus#POLLING}.
   *
   * @param health the new health, never null
   */
  void onHealthChange(ConnectionHealth health);
}
