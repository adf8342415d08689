package org.waabox.vigia.client.jdbc;

import org.waabox.vigia.VigiaException;

/**
 * Thrown when the JDBC client cannot reach the database or a statement
 * fails.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class JdbcClientException extends VigiaException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, may be null.
   */
  public JdbcClientException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
