package org.waabox.vigia.transport;

import java.util.Optional;

import org.waabox.vigia.VigiaException;

/**
 * The live delivery handle of one topic.
 *
 * <p>A handle delivers nothing until {@link #activate()} is called, so the
 * subscription registry can close the previous handle of a topic before
 * the new one starts emitting.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface TransportHandle {

  /**
   * Returns the kind of this handle.
   *
   * @return the kind, never null
   */
  TransportKind kind();

  /** Starts delivering changes. Has no effect on a closed handle. */
  void activate();

  /**
   * Returns the failure this handle reported when it stopped delivering
   * on its own.
   *
   * @return the failure, empty while the handle is healthy
   */
  default Optional<VigiaException> failure() {
    return Optional.empty();
  }

  /**
   * Stops delivering changes and releases the channel or timer behind the
   * handle. Calling it more than once has no effect.
   */
  void close();
}
