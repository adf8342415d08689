package org.waabox.vigia;

import java.time.Instant;

import org.waabox.vigia.connection.CircuitState;
import org.waabox.vigia.connection.ConnectionStatus;

/**
 * A point-in-time view of the connection and the topics, as returned by
 * {@link Vigia#connectionStatus()}.
 *
 * <p>The status is the connection health status, except that a healthy or
 * idle connection with polling topics is reported as
 * {@link ConnectionStatus#POLLING}.
 *
 * @param status            the reported status, never null
 * @param failureCount      failures since the last successful connection
 * @param circuitState      the circuit state, never null
 * @param activeTopicCount  the topics on push
 * @param pollingTopicCount the topics on poll
 * @param pendingTopicCount the topics without a transport
 * @param lastConnectedAt   the last successful connection, null if never
 * @param nextRetryAt       when an open circuit admits an attempt, may be
 *                          null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ConnectionStatusReport(
    ConnectionStatus status,
    int failureCount,
    CircuitState circuitState,
    int activeTopicCount,
    int pollingTopicCount,
    int pendingTopicCount,
    Instant lastConnectedAt,
    Instant nextRetryAt
) {
}
