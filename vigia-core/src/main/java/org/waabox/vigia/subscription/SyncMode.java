package org.waabox.vigia.subscription;

/**
 * The aggregated delivery mode of the subscription registry.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SyncMode {

  /** No topic is subscribed. */
  IDLE,

  /** Every topic is on push. */
  REALTIME,

  /** At least one topic is polling or waiting for a transport. */
  DEGRADED
}
