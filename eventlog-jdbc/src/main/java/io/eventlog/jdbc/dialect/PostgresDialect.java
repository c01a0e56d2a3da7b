package io.eventlog.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect. Payloads are stored as {@code JSONB}.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<String> createTableSql(String table) {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + table + " (" +
            "id UUID PRIMARY KEY, " +
            "aggregate_id UUID NOT NULL, " +
            "payload JSONB NOT NULL, " +
            "occurred_at TIMESTAMPTZ NOT NULL, " +
            "sequence_number BIGINT NOT NULL, " +
            "UNIQUE (aggregate_id, sequence_number))");
  }

  @Override
  public String insertSql(String table) {
    return "INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?,?,CAST(? AS JSONB),?,?)";
  }

  @Override
  public String updatePayloadSql(String table) {
    return "UPDATE " + table + " SET payload=CAST(? AS JSONB) WHERE id=?";
  }
}
