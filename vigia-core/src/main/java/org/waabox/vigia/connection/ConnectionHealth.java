package org.waabox.vigia.connection;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable snapshot of the shared connection's health.
 *
 * <p>Only the {@link ConnectionFactory} produces new snapshots. A
 * {@link ConnectionStatus#CONNECTED} snapshot always has a failure count
 * of zero.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConnectionHealth {

  /** The overall mode, never null. */
  private final ConnectionStatus status;

  /** When the last successful connection test happened, may be null. */
  private final Instant lastConnectedAt;

  /** Failures since the last successful connection test. */
  private final int failureCount;

  /** When an open circuit allows a new attempt, may be null. */
  private final Instant nextRetryAt;

  private ConnectionHealth(final ConnectionStatus theStatus,
      final Instant theLastConnectedAt, final int theFailureCount,
      final Instant theNextRetryAt) {
    status = Objects.requireNonNull(theStatus, "status cannot be null");
    lastConnectedAt = theLastConnectedAt;
    failureCount = theFailureCount;
    nextRetryAt = theNextRetryAt;
  }

  /**
   * Returns the health of a factory that never connected.
   *
   * @return the initial health, never null
   */
  public static ConnectionHealth initial() {
    return new ConnectionHealth(ConnectionStatus.DISCONNECTED, null, 0, null);
  }

  static ConnectionHealth connected(final Instant now) {
    return new ConnectionHealth(ConnectionStatus.CONNECTED, now, 0, null);
  }

  ConnectionHealth withStatus(final ConnectionStatus theStatus) {
    return new ConnectionHealth(theStatus, lastConnectedAt, failureCount,
        nextRetryAt);
  }

  ConnectionHealth withFailureCount(final int theFailureCount) {
    return new ConnectionHealth(status, lastConnectedAt, theFailureCount,
        nextRetryAt);
  }

  ConnectionHealth failed(final int theFailureCount,
      final Instant theNextRetryAt) {
    return new ConnectionHealth(ConnectionStatus.FAILED, lastConnectedAt,
        theFailureCount, theNextRetryAt);
  }

  ConnectionHealth degraded(final int theFailureCount,
      final Instant theNextRetryAt) {
    return new ConnectionHealth(ConnectionStatus.POLLING, lastConnectedAt,
        theFailureCount, theNextRetryAt);
  }

  public ConnectionStatus status() {
    return status;
  }

  public Optional<Instant> lastConnectedAt() {
    return Optional.ofNullable(lastConnectedAt);
  }

  public int failureCount() {
    return failureCount;
  }

  public Optional<Instant> nextRetryAt() {
    return Optional.ofNullable(nextRetryAt);
  }

  @Override
  public String toString() {
    return "ConnectionHealth[status=" + status
        + ", failureCount=" + failureCount
        + ", lastConnectedAt=" + lastConnectedAt
        + ", nextRetryAt=" + nextRetryAt + "]";
  }
}
