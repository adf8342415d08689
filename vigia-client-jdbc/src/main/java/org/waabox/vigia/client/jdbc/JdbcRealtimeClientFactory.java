package org.waabox.vigia.client.jdbc;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.client.RealtimeClient;
import org.waabox.vigia.client.RealtimeClientFactory;
import org.waabox.vigia.client.RealtimeEndpoint;

/**
 * Creates {@link JdbcRealtimeClient} instances over a shared
 * {@link javax.sql.DataSource}.
 *
 * <p>The endpoint is only used for logging; the data source already
 * carries the database address and credentials.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcRealtimeClientFactory implements RealtimeClientFactory {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdbcRealtimeClientFactory.class);

  /** The client configuration, never null. */
  private final JdbcClientConfig config;

  /**
   * Creates a new factory.
   *
   * @param theConfig the client configuration, never null
   */
  public JdbcRealtimeClientFactory(final JdbcClientConfig theConfig) {
    config = Objects.requireNonNull(theConfig, "config cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public RealtimeClient create(final RealtimeEndpoint endpoint) {
    Objects.requireNonNull(endpoint, "endpoint cannot be null");
    log.debug("Creating JDBC client for {}", endpoint);
    return new JdbcRealtimeClient(config);
  }
}
