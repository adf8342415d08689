package org.waabox.vigia.metrics;

import org.waabox.vigia.transport.TransportKind;

/**
 * An abstraction for recording operational metrics of the
 * synchronization layer.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopVigiaMetrics} when
 * metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface VigiaMetrics {

  /**
   * Records a successful connection.
   *
   * @param attempts the number of attempts it took, at least 1
   */
  void connectionEstablished(int attempts);

  /**
   * Records a failed connection attempt.
   *
   * @param attempt the 1-based attempt number
   * @param cause   the failure, never null
   */
  void connectionAttemptFailed(int attempt, Throwable cause);

  /** Records a connection request rejected by the open circuit. */
  void circuitRejected();

  /**
   * Records a topic moving to a transport.
   *
   * @param topicKey the topic key, never null
   * @param kind     the transport now active, never null
   */
  void transportActivated(String topicKey, TransportKind kind);

  /**
   * Records a failed poll tick.
   *
   * @param topicKey the topic key, never null
   * @param cause    the failure, never null
   */
  void pollFailed(String topicKey, Throwable cause);
}
