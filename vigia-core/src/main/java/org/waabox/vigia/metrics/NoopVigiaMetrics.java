package org.waabox.vigia.metrics;

import org.waabox.vigia.transport.TransportKind;

/**
 * A no-operation implementation of {@link VigiaMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopVigiaMetrics implements VigiaMetrics {

  /** {@inheritDoc} */
  @Override
  public void connectionEstablished(final int attempts) {
  }

  /** {@inheritDoc} */
  @Override
  public void connectionAttemptFailed(final int attempt,
      final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void circuitRejected() {
  }

  /** {@inheritDoc} */
  @Override
  public void transportActivated(final String topicKey,
      final TransportKind kind) {
  }

  /** {@inheritDoc} */
  @Override
  public void pollFailed(final String topicKey, final Throwable cause) {
  }
}
