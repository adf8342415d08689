package org.waabox.vigia.transport;

/**
 * The kind of a topic's delivery transport.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum TransportKind {

  /** A persistent channel streaming row-level changes. */
  PUSH,

  /** A periodic query with whole-snapshot change detection. */
  POLL
}
