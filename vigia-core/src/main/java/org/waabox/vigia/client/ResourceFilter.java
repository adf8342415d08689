package org.waabox.vigia.client;

import java.util.Objects;

/**
 * A single-column filter applied to a {@link Resource}.
 *
 * @param column   the filtered column, never null
 * @param operator the comparison operator, never null
 * @param value    the value compared against, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ResourceFilter(
    String column,
    FilterOperator operator,
    String value
) {

  /** Validates the filter components. */
  public ResourceFilter {
    Objects.requireNonNull(column, "column cannot be null");
    Objects.requireNonNull(operator, "operator cannot be null");
    Objects.requireNonNull(value, "value cannot be null");
    if (column.isBlank()) {
      throw new IllegalArgumentException("column cannot be blank");
    }
  }

  /**
   * Parses a filter written as {@code "column operator value"}, for
   * example {@code "room_id eq 42"} or {@code "score >= 10"}.
   *
   * <p>The value is everything after the operator, so it may contain
   * spaces.
   *
   * @param expression the filter expression, never null
   *
   * @return the parsed filter, never null
   *
   * @throws IllegalArgumentException if the expression does not have the
   *                                  three expected parts
   */
  public static ResourceFilter parse(final String expression) {
    Objects.requireNonNull(expression, "expression cannot be null");
    final String[] parts = expression.trim().split("\\s+", 3);
    if (parts.length < 3) {
      throw new IllegalArgumentException(
          "Filter must be 'column operator value', got: " + expression);
    }
    return new ResourceFilter(parts[0], FilterOperator.parse(parts[1]),
        parts[2]);
  }

  /**
   * Renders this filter back to its textual form.
   *
   * @return the filter expression, never null
   */
  @Override
  public String toString() {
    return column + " " + operator.name().toLowerCase() + " " + value;
  }
}
