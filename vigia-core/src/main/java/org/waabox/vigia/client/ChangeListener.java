package org.waabox.vigia.client;

/**
 * A listener that is notified of change events for a topic.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ChangeListener {

  /**
   * Called when a change is observed.
   *
   * @param event the change event, never null
   */
  void onChange(ChangeEvent event);
}
