package io.eventlog.jdbc.dialect;

import java.sql.SQLException;
import java.util.List;

/**
 * H2 dialect, used mostly for tests and embedded deployments.
 */
public final class H2Dialect extends AbstractDialect {

  // Concurrent update in another session (MVStore row lock conflict)
  private static final int CONCURRENT_UPDATE = 90131;

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public List<String> createTableSql(String table) {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + table + " (" +
            "id UUID PRIMARY KEY, " +
            "aggregate_id UUID NOT NULL, " +
            "payload CLOB NOT NULL, " +
            "occurred_at TIMESTAMP(6) WITH TIME ZONE NOT NULL, " +
            "sequence_number BIGINT NOT NULL, " +
            "CONSTRAINT uk_" + table + "_sequence UNIQUE (aggregate_id, sequence_number))");
  }

  @Override
  public boolean isUniqueViolation(SQLException e) {
    if (super.isUniqueViolation(e)) {
      return true;
    }
    for (SQLException current = e; current != null; current = current.getNextException()) {
      if (current.getErrorCode() == CONCURRENT_UPDATE) {
        return true;
      }
    }
    return false;
  }
}
