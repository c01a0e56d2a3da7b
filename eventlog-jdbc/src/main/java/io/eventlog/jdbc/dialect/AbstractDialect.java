package io.eventlog.jdbc.dialect;

import io.eventlog.jdbc.spi.Dialect;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses can override methods to provide database-specific SQL.
 */
public abstract class AbstractDialect implements Dialect {

  protected static final String UNIQUE_VIOLATION_STATE = "23505";

  protected static final String COLUMNS = "id, aggregate_id, payload, occurred_at, sequence_number";

  @Override
  public String insertSql(String table) {
    return "INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?,?,?,?,?)";
  }

  @Override
  public String selectByAggregateIdSql(String table) {
    return "SELECT " + COLUMNS + " FROM " + table +
        " WHERE aggregate_id=? ORDER BY sequence_number";
  }

  @Override
  public String selectByIdSql(String table) {
    return "SELECT " + COLUMNS + " FROM " + table + " WHERE id=?";
  }

  @Override
  public String updatePayloadSql(String table) {
    return "UPDATE " + table + " SET payload=? WHERE id=?";
  }

  @Override
  public String deleteByAggregateIdSql(String table) {
    return "DELETE FROM " + table + " WHERE aggregate_id=?";
  }

  @Override
  public String deleteByIdSql(String table) {
    return "DELETE FROM " + table + " WHERE id=?";
  }

  @Override
  public Object uuidParam(UUID uuid) {
    return uuid;
  }

  @Override
  public UUID readUuid(ResultSet rs, String column) throws SQLException {
    return rs.getObject(column, UUID.class);
  }

  /**
   * Binds a UTC {@link OffsetDateTime}, for columns that carry a time zone.
   */
  @Override
  public Object timestampParam(Instant instant) {
    return instant.atOffset(ZoneOffset.UTC);
  }

  @Override
  public Instant readTimestamp(ResultSet rs, String column) throws SQLException {
    OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
    return value == null ? null : value.toInstant();
  }

  @Override
  public boolean isUniqueViolation(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      if (UNIQUE_VIOLATION_STATE.equals(current.getSQLState())) {
        return true;
      }
    }
    return false;
  }
}
