package io.eventlog.jdbc.dialect;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * MySQL dialect. UUIDs are stored as {@code CHAR(36)}, payloads as {@code JSON}.
 *
 * <p>{@code DATETIME} has no zone, so {@code occurred_at} holds UTC wall-clock time,
 * bound as a {@link LocalDateTime} which the driver passes through unconverted.
 */
public final class MySqlDialect extends AbstractDialect {

  private static final int DUPLICATE_ENTRY = 1062;

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  public List<String> createTableSql(String table) {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + table + " (" +
            "id CHAR(36) NOT NULL PRIMARY KEY, " +
            "aggregate_id CHAR(36) NOT NULL, " +
            "payload JSON NOT NULL, " +
            "occurred_at DATETIME(6) NOT NULL, " +
            "sequence_number BIGINT NOT NULL, " +
            "UNIQUE KEY uk_sequence (aggregate_id, sequence_number))");
  }

  @Override
  public Object uuidParam(UUID uuid) {
    return uuid.toString();
  }

  @Override
  public UUID readUuid(ResultSet rs, String column) throws SQLException {
    String value = rs.getString(column);
    return value == null ? null : UUID.fromString(value);
  }

  @Override
  public Object timestampParam(Instant instant) {
    return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
  }

  @Override
  public Instant readTimestamp(ResultSet rs, String column) throws SQLException {
    LocalDateTime value = rs.getObject(column, LocalDateTime.class);
    return value == null ? null : value.toInstant(ZoneOffset.UTC);
  }

  @Override
  public boolean isUniqueViolation(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      if (current.getErrorCode() == DUPLICATE_ENTRY) {
        return true;
      }
    }
    return false;
  }
}
