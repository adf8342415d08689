package org.waabox.vigia.client;

import java.util.Objects;
import java.util.Optional;

/**
 * An opaque selector of the data a topic is interested in: a table,
 * optionally filtered, ordered and limited.
 *
 * <p>Push transports pass it to
 * {@link Channel#onChange(Resource, ChangeListener)}; poll transports pass
 * it to {@link RealtimeClient#query(Resource)}.
 *
 * <p>Defaults: schema {@code public}, ordered by {@code created_at}
 * descending, at most 50 rows.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Resource {

  /** The default schema. */
  private static final String DEFAULT_SCHEMA = "public";

  /** The default ordering column. */
  private static final String DEFAULT_ORDER_BY = "created_at";

  /** The default row limit. */
  private static final int DEFAULT_LIMIT = 50;

  /** The schema name, never null. */
  private final String schema;

  /** The table name, never null. */
  private final String table;

  /** The optional filter, may be null. */
  private final ResourceFilter filter;

  /** The optional descending ordering column, may be null. */
  private final String orderBy;

  /** The row limit, always positive. */
  private final int limit;

  private Resource(final String theSchema, final String theTable,
      final ResourceFilter theFilter, final String theOrderBy,
      final int theLimit) {
    schema = theSchema;
    table = theTable;
    filter = theFilter;
    orderBy = theOrderBy;
    limit = theLimit;
  }

  /**
   * Creates a resource for the given table with default settings.
   *
   * @param table the table name, never null or blank
   *
   * @return a new resource, never null
   */
  public static Resource table(final String table) {
    requireName(table, "table");
    return new Resource(DEFAULT_SCHEMA, table, null, DEFAULT_ORDER_BY,
        DEFAULT_LIMIT);
  }

  /**
   * Returns a copy of this resource in the given schema.
   *
   * @param theSchema the schema name, never null or blank
   *
   * @return a new resource, never null
   */
  public Resource inSchema(final String theSchema) {
    requireName(theSchema, "schema");
    return new Resource(theSchema, table, filter, orderBy, limit);
  }

  /**
   * Returns a copy of this resource filtered by the given filter.
   *
   * @param theFilter the filter, never null
   *
   * @return a new resource, never null
   */
  public Resource filteredBy(final ResourceFilter theFilter) {
    Objects.requireNonNull(theFilter, "filter cannot be null");
    return new Resource(schema, table, theFilter, orderBy, limit);
  }

  /**
   * Returns a copy of this resource filtered by a textual filter.
   *
   * @param expression the filter, as {@code "column operator value"}
   *
   * @return a new resource, never null
   *
   * @see ResourceFilter#parse(String)
   */
  public Resource filteredBy(final String expression) {
    return filteredBy(ResourceFilter.parse(expression));
  }

  /**
   * Returns a copy of this resource ordered descending by the given
   * column.
   *
   * @param column the ordering column, never null or blank
   *
   * @return a new resource, never null
   */
  public Resource orderedBy(final String column) {
    requireName(column, "orderBy");
    return new Resource(schema, table, filter, column, limit);
  }

  /**
   * Returns a copy of this resource without ordering.
   *
   * @return a new resource, never null
   */
  public Resource unordered() {
    return new Resource(schema, table, filter, null, limit);
  }

  /**
   * Returns a copy of this resource limited to the given row count.
   *
   * @param theLimit the maximum number of rows, must be positive
   *
   * @return a new resource, never null
   */
  public Resource limit(final int theLimit) {
    if (theLimit <= 0) {
      throw new IllegalArgumentException(
          "limit must be greater than 0, got: " + theLimit);
    }
    return new Resource(schema, table, filter, orderBy, theLimit);
  }

  public String schema() {
    return schema;
  }

  public String table() {
    return table;
  }

  public Optional<ResourceFilter> filter() {
    return Optional.ofNullable(filter);
  }

  public Optional<String> orderBy() {
    return Optional.ofNullable(orderBy);
  }

  public int limit() {
    return limit;
  }

  private static void requireName(final String value, final String name) {
    Objects.requireNonNull(value, name + " cannot be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " cannot be blank");
    }
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Resource)) {
      return false;
    }
    final Resource that = (Resource) other;
    return limit == that.limit
        && schema.equals(that.schema)
        && table.equals(that.table)
        && Objects.equals(filter, that.filter)
        && Objects.equals(orderBy, that.orderBy);
  }

  @Override
  public int hashCode() {
    return Objects.hash(schema, table, filter, orderBy, limit);
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder(schema).append('.')
        .append(table);
    if (filter != null) {
      sb.append(" [").append(filter).append(']');
    }
    return sb.toString();
  }
}
