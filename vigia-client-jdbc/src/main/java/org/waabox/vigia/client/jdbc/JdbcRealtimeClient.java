package org.waabox.vigia.client.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.client.Channel;
import org.waabox.vigia.client.ChangeListener;
import org.waabox.vigia.client.ChannelStatus;
import org.waabox.vigia.client.ChannelStatusListener;
import org.waabox.vigia.client.RealtimeClient;
import org.waabox.vigia.client.Resource;
import org.waabox.vigia.client.ResourceFilter;

/**
 * A poll-only {@link RealtimeClient} that reads a relational database
 * through JDBC.
 *
 * <p>The probe runs {@code SELECT 1}. Queries are rendered as
 * {@code SELECT * FROM schema.table [WHERE column op ?]
 * [ORDER BY column DESC] LIMIT ?}; the filter value and the limit are
 * bound as statement parameters and every identifier must be a plain SQL
 * name.
 *
 * <p>A database has no push stream, so every channel this client opens
 * reports {@link ChannelStatus#CHANNEL_ERROR} as soon as it is subscribed
 * and topics served by it always run on poll.
 *
 * <p>This class is thread-safe; each call borrows its own connection.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcRealtimeClient implements RealtimeClient {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdbcRealtimeClient.class);

  /** Accepted schema, table and column names. */
  private static final Pattern IDENTIFIER =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /** The client configuration, never null. */
  private final JdbcClientConfig config;

  /** Whether close() has been called. */
  private volatile boolean closed;

  /**
   * Creates a new client.
   *
   * @param theConfig the client configuration, never null
   */
  public JdbcRealtimeClient(final JdbcClientConfig theConfig) {
    config = Objects.requireNonNull(theConfig, "config cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public void probe() {
    requireOpen();
    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement("SELECT 1")) {

      ps.setQueryTimeout(timeoutSeconds());
      try (final ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          throw new JdbcClientException("Probe returned no rows", null);
        }
      }

    } catch (final SQLException e) {
      throw new JdbcClientException("Database probe failed", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Channel openChannel(final String topic) {
    Objects.requireNonNull(topic, "topic cannot be null");
    requireOpen();
    return new PollOnlyChannel(topic);
  }

  /** {@inheritDoc} */
  @Override
  public List<Map<String, Object>> query(final Resource resource) {
    Objects.requireNonNull(resource, "resource cannot be null");
    requireOpen();

    final String sql = render(resource);
    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql)) {

      ps.setQueryTimeout(timeoutSeconds());
      int index = 1;
      if (resource.filter().isPresent()) {
        ps.setString(index++, resource.filter().get().value());
      }
      ps.setInt(index, resource.limit());

      try (final ResultSet rs = ps.executeQuery()) {
        final List<Map<String, Object>> rows = readRows(rs);
        log.trace("Query '{}' returned {} row(s)", sql, rows.size());
        return rows;
      }

    } catch (final SQLException e) {
      throw new JdbcClientException("Failed to query " + resource, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    closed = true;
  }

  /**
   * Renders the select statement of a resource.
   *
   * @param resource the resource, never null
   *
   * @return the SQL with a placeholder per bound value, never null
   *
   * @throws IllegalArgumentException if an identifier is not a plain name
   */
  static String render(final Resource resource) {
    final StringBuilder sql = new StringBuilder("SELECT * FROM ")
        .append(identifier(resource.schema()))
        .append('.')
        .append(identifier(resource.table()));

    if (resource.filter().isPresent()) {
      final ResourceFilter filter = resource.filter().get();
      sql.append(" WHERE ")
          .append(identifier(filter.column()))
          .append(' ')
          .append(filter.operator().sql())
          .append(" ?");
    }
    resource.orderBy().ifPresent(column ->
        sql.append(" ORDER BY ").append(identifier(column)).append(" DESC"));

    return sql.append(" LIMIT ?").toString();
  }

  private static String identifier(final String name) {
    if (!IDENTIFIER.matcher(name).matches()) {
      throw new IllegalArgumentException("Invalid SQL identifier: " + name);
    }
    return name;
  }

  private static List<Map<String, Object>> readRows(final ResultSet rs)
      throws SQLException {
    final ResultSetMetaData meta = rs.getMetaData();
    final int columns = meta.getColumnCount();
    final List<Map<String, Object>> rows = new ArrayList<>();
    while (rs.next()) {
      final Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 1; i <= columns; i++) {
        row.put(meta.getColumnLabel(i), rs.getObject(i));
      }
      rows.add(Collections.unmodifiableMap(row));
    }
    return rows;
  }

  private int timeoutSeconds() {
    return (int) config.queryTimeout().getSeconds();
  }

  private void requireOpen() {
    if (closed) {
      throw new IllegalStateException("JdbcRealtimeClient is closed");
    }
  }

  /** A channel that can never join; the database has no push stream. */
  private static final class PollOnlyChannel implements Channel {

    private final String topic;

    private PollOnlyChannel(final String theTopic) {
      topic = theTopic;
    }

    @Override
    public Channel onChange(final Resource resource,
        final ChangeListener listener) {
      Objects.requireNonNull(resource, "resource cannot be null");
      Objects.requireNonNull(listener, "listener cannot be null");
      return this;
    }

    @Override
    public void subscribe(final ChannelStatusListener statusListener) {
      Objects.requireNonNull(statusListener,
          "statusListener cannot be null");
      log.debug("Channel '{}' rejected, JDBC client is poll-only", topic);
      statusListener.onStatus(ChannelStatus.CHANNEL_ERROR,
          new UnsupportedOperationException(
              "JDBC client does not support push channels"));
    }

    @Override
    public void unsubscribe() {
      // nothing to leave.
    }
  }
}
