package org.waabox.vigia.client;

import java.util.Locale;

/**
 * Comparison operators accepted in a {@link ResourceFilter}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum FilterOperator {

  EQ("="),
  NEQ("<>"),
  GT(">"),
  GTE(">="),
  LT("<"),
  LTE("<="),
  LIKE("LIKE");

  /** The SQL rendition of the operator. */
  private final String sql;

  /** Creates the operator.
   *
   * @param theSql the SQL rendition, never null
   */
  FilterOperator(final String theSql) {
    sql = theSql;
  }

  /**
   * Returns the SQL rendition of this operator.
   *
   * @return the SQL operator, never null
   */
  public String sql() {
    return sql;
  }

  /**
   * Resolves an operator from its name ({@code eq}, {@code gte}, ...) or
   * its symbol ({@code =}, {@code >=}, ...), ignoring case.
   *
   * @param token the operator token, never null
   *
   * @return the operator, never null
   *
   * @throws IllegalArgumentException if the token is not a known operator
   */
  public static FilterOperator parse(final String token) {
    final String normalized = token.trim().toUpperCase(Locale.ROOT);
    for (final FilterOperator operator : values()) {
      if (operator.name().equals(normalized)
          || operator.sql.equals(normalized)) {
        return operator;
      }
    }
    if ("!=".equals(normalized)) {
      return NEQ;
    }
    throw new IllegalArgumentException("Unknown filter operator: " + token);
  }
}
