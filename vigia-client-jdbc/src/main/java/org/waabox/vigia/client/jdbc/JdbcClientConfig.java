package org.waabox.vigia.client.jdbc;

import java.time.Duration;
import java.util.Objects;

import javax.sql.DataSource;

/**
 * Configuration for the JDBC realtime client.
 *
 * <p>Holds the {@link DataSource} the client queries and the timeout
 * applied to every statement it runs.
 *
 * <p>Instances are created via the static factory methods
 * {@link #create(DataSource)} and {@link #create(DataSource, Duration)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcClientConfig {

  /** Default statement timeout (5 seconds). */
  private static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(5);

  /** The JDBC data source, never null. */
  private final DataSource dataSource;

  /** The statement timeout, never null. */
  private final Duration queryTimeout;

  /** Private constructor; use static factories.
   *
   * @param theDataSource   the JDBC data source
   * @param theQueryTimeout the statement timeout
   */
  private JdbcClientConfig(final DataSource theDataSource,
      final Duration theQueryTimeout) {
    dataSource = theDataSource;
    queryTimeout = theQueryTimeout;
  }

  /**
   * Creates a configuration with a custom statement timeout.
   *
   * @param dataSource   the JDBC data source, never null
   * @param queryTimeout the statement timeout, at least one second
   *
   * @return a new configuration instance, never null
   */
  public static JdbcClientConfig create(final DataSource dataSource,
      final Duration queryTimeout) {
    Objects.requireNonNull(dataSource, "dataSource cannot be null");
    Objects.requireNonNull(queryTimeout, "queryTimeout cannot be null");

    if (queryTimeout.getSeconds() < 1) {
      throw new IllegalArgumentException(
          "queryTimeout must be at least one second, got: " + queryTimeout);
    }

    return new JdbcClientConfig(dataSource, queryTimeout);
  }

  /**
   * Creates a configuration with the default 5 seconds statement timeout.
   *
   * @param dataSource the JDBC data source, never null
   *
   * @return a new configuration instance, never null
   */
  public static JdbcClientConfig create(final DataSource dataSource) {
    return create(dataSource, DEFAULT_QUERY_TIMEOUT);
  }

  /**
   * Returns the JDBC data source.
   *
   * @return the data source, never null
   */
  public DataSource dataSource() {
    return dataSource;
  }

  /**
   * Returns the statement timeout.
   *
   * @return the query timeout, never null
   */
  public Duration queryTimeout() {
    return queryTimeout;
  }
}
