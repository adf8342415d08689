package org.waabox.vigia.connection;

/**
 * The state of the {@link CircuitBreaker}, derived from a
 * {@link ConnectionHealth}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum CircuitState {

  /** Failures below the threshold; attempts proceed. */
  CLOSED,

  /** Threshold reached and the cool-down has not elapsed; attempts are
   * rejected without touching the network. */
  OPEN,

  /** Threshold reached and the cool-down elapsed; one probing attempt is
   * allowed. */
  HALF_OPEN
}
