package org.waabox.vigia.connection;

import java.time.Instant;
import java.util.Optional;

import org.waabox.vigia.VigiaException;

/**
 * Thrown by {@link ConnectionFactory#getConnection()} when the circuit is
 * open or a gated connection attempt exhausted its retries.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ConnectionUnavailableException extends VigiaException {

  private static final long serialVersionUID = 1L;

  /** The short reason, never null. */
  private final String reason;

  /** When a new attempt may be made, may be null. */
  private final Instant retryAfter;

  /**
   * Creates a new exception.
   *
   * @param theReason     the short reason, never null
   * @param theRetryAfter when a new attempt may be made, may be null
   * @param cause         the last underlying error, may be null
   */
  public ConnectionUnavailableException(final String theReason,
      final Instant theRetryAfter, final Throwable cause) {
    super("Connection unavailable: " + theReason
        + (theRetryAfter == null ? "" : ", retry after " + theRetryAfter),
        cause);
    reason = theReason;
    retryAfter = theRetryAfter;
  }

  /**
   * Returns the short reason, for example {@code "circuit open"}.
   *
   * @return the reason, never null
   */
  public String reason() {
    return reason;
  }

  /**
   * Returns when a new attempt may be made.
   *
   * @return the retry instant, empty if unknown
   */
  public Optional<Instant> retryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}
