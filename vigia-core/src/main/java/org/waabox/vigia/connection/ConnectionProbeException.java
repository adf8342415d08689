package org.waabox.vigia.connection;

import org.waabox.vigia.VigiaException;

/**
 * Thrown when the connectivity probe of a client fails or times out.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ConnectionProbeException extends VigiaException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, may be null.
   */
  public ConnectionProbeException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
