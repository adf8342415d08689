package org.waabox.vigia.connection;

/**
 * The overall connection mode.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ConnectionStatus {

  /** No connection was attempted yet, or the factory was destroyed. */
  DISCONNECTED,

  /** A gated connection attempt is in flight. */
  CONNECTING,

  /** The shared client passed its last connectivity probe. */
  CONNECTED,

  /** The last gated attempt exhausted its retries. */
  FAILED,

  /** The shared client failed a health probe; topics run degraded. */
  POLLING
}
