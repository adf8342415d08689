package org.waabox.vigia.client;

/**
 * The kind of row-level change carried by a {@link ChangeEvent}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ChangeType {
  INSERT,
  UPDATE,
  DELETE
}
