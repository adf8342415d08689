package org.waabox.vigia.client;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A row-level change delivered to a {@link ChangeListener}.
 *
 * <p>Push transports deliver the exact change reported by the service.
 * Poll transports cannot tell which row changed; they synthesize an
 * {@link ChangeType#UPDATE} whose new row is the first row of the latest
 * result and whose old row is absent.
 *
 * @param type       the change type, never null
 * @param schema     the schema of the changed table, never null
 * @param table      the changed table, never null
 * @param newRow     the row after the change, null for deletes or empty
 *                   poll results
 * @param oldRow     the row before the change, may be null
 * @param receivedAt when the change was observed, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChangeEvent(
    ChangeType type,
    String schema,
    String table,
    Map<String, Object> newRow,
    Map<String, Object> oldRow,
    Instant receivedAt
) {

  /** Validates the mandatory components. */
  public ChangeEvent {
    Objects.requireNonNull(type, "type cannot be null");
    Objects.requireNonNull(schema, "schema cannot be null");
    Objects.requireNonNull(table, "table cannot be null");
    Objects.requireNonNull(receivedAt, "receivedAt cannot be null");
  }

  /**
   * Creates the event a poll transport emits when a resource's rows
   * changed.
   *
   * @param resource   the polled resource, never null
   * @param latestRow  the first row of the latest result, may be null
   * @param receivedAt when the change was detected, never null
   *
   * @return the synthesized update event, never null
   */
  public static ChangeEvent polledUpdate(final Resource resource,
      final Map<String, Object> latestRow, final Instant receivedAt) {
    Objects.requireNonNull(resource, "resource cannot be null");
    return new ChangeEvent(ChangeType.UPDATE, resource.schema(),
        resource.table(), latestRow, null, receivedAt);
  }

  /**
   * Returns the row after the change.
   *
   * @return the new row, empty if there is none
   */
  public Optional<Map<String, Object>> newValue() {
    return Optional.ofNullable(newRow);
  }

  /**
   * Returns the row before the change.
   *
   * @return the old row, empty if there is none
   */
  public Optional<Map<String, Object>> oldValue() {
    return Optional.ofNullable(oldRow);
  }
}
