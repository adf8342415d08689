package org.waabox.vigia;

/**
 * Receives the transport errors of a single topic.
 *
 * <p>Errors reported here are already handled: the topic falls back to
 * polling or keeps its polling timer running. The listener is informative.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ErrorListener {

  /**
   * Called when a transport error affects the topic.
   *
   * @param error the error, never null
   */
  void onError(VigiaException error);
}
