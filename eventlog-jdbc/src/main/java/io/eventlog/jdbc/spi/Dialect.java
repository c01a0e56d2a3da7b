package io.eventlog.jdbc.spi;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide database-specific DDL, SQL and type handling for event tables.
 * Register custom dialects via {@code META-INF/services/io.eventlog.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: PostgreSQL, MySQL, H2.
 *
 * @see io.eventlog.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:postgresql:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Idempotent DDL statements creating the event table.
   *
   * <p>The table must enforce uniqueness of {@code (aggregate_id, sequence_number)}.
   */
  List<String> createTableSql(String table);

  /**
   * SQL for inserting a new event.
   *
   * <p>Parameters (in order):
   * <ol>
   *   <li>id ({@link #uuidParam})</li>
   *   <li>aggregate_id ({@link #uuidParam})</li>
   *   <li>payload (String/JSON)</li>
   *   <li>occurred_at ({@link #timestampParam})</li>
   *   <li>sequence_number (long)</li>
   * </ol>
   */
  String insertSql(String table);

  /**
   * SQL selecting all events of one aggregate in ascending sequence order.
   *
   * <p>Parameters: aggregate_id
   *
   * <p>Returns columns: id, aggregate_id, payload, occurred_at, sequence_number
   */
  String selectByAggregateIdSql(String table);

  /**
   * SQL selecting a single event by its id.
   *
   * <p>Parameters: id
   */
  String selectByIdSql(String table);

  /**
   * SQL replacing the payload of a single event.
   *
   * <p>Parameters: payload (String/JSON), id
   */
  String updatePayloadSql(String table);

  /**
   * SQL deleting every event of one aggregate.
   *
   * <p>Parameters: aggregate_id
   */
  String deleteByAggregateIdSql(String table);

  /**
   * SQL deleting a single event by its id.
   *
   * <p>Parameters: id
   */
  String deleteByIdSql(String table);

  /**
   * Converts a UUID into the JDBC parameter this database stores it as.
   */
  Object uuidParam(UUID uuid);

  /**
   * Reads a UUID column from the current row.
   */
  UUID readUuid(ResultSet rs, String column) throws SQLException;

  /**
   * Converts an instant to the JDBC parameter for {@code occurred_at}. The value must
   * not depend on the JVM's default time zone.
   */
  Object timestampParam(Instant instant);

  /**
   * Reads the {@code occurred_at} column written with {@link #timestampParam}.
   */
  Instant readTimestamp(ResultSet rs, String column) throws SQLException;

  /**
   * Whether the exception reports a violated unique constraint, i.e. another writer
   * already stored an event at the same sequence number.
   */
  boolean isUniqueViolation(SQLException e);
}
