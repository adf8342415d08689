package org.waabox.vigia;

/**
 * Base exception for all Vigia-related errors.
 *
 * <p>This is an unchecked exception. Specific failures (client creation,
 * connection unavailability, subscription or poll errors) extend it so
 * callers can catch the whole family at once.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class VigiaException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public VigiaException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, may be null.
   */
  public VigiaException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
