package org.waabox.vigia.client;

import org.waabox.vigia.VigiaException;

/**
 * Thrown when the underlying realtime client cannot be constructed, for
 * example because of a bad endpoint configuration.
 *
 * <p>The connection factory retries these failures with backoff and
 * eventually surfaces them wrapped in a
 * {@link org.waabox.vigia.connection.ConnectionUnavailableException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ClientCreationException extends VigiaException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ClientCreationException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, may be null.
   */
  public ClientCreationException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
