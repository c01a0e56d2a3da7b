package io.eventlog.jdbc;

import java.util.Objects;

/**
 * Maps aggregate names to event table names and validates them.
 *
 * <p>Aggregate {@code "order"} is stored in table {@code order_events}.
 */
public final class TableNames {
  public static final String SUFFIX = "_events";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";
  // PostgreSQL truncates identifiers beyond 63 bytes
  private static final int MAX_LENGTH = 63;

  private TableNames() {}

  public static String forAggregate(String aggregateName) {
    Objects.requireNonNull(aggregateName, "aggregateName");
    if (aggregateName.isEmpty()) {
      throw new IllegalArgumentException("aggregateName cannot be empty");
    }
    return validate(aggregateName + SUFFIX);
  }

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    if (tableName.length() > MAX_LENGTH) {
      throw new IllegalArgumentException("Table name longer than " + MAX_LENGTH + " characters: " + tableName);
    }
    return tableName;
  }
}
