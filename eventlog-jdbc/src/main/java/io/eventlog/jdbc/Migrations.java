package io.eventlog.jdbc;

import io.eventlog.StorageException;
import io.eventlog.jdbc.spi.Dialect;
import io.eventlog.jdbc.tx.JdbcTransactionManager;
import io.eventlog.spi.ConnectionProvider;

import java.sql.SQLException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates event tables on demand.
 *
 * <p>{@link #ensureSchema(String)} is idempotent: the DDL uses {@code IF NOT EXISTS}
 * and every table ensured by this instance is remembered, so repeated calls for the
 * same aggregate do not touch the database again. Share one instance between stores
 * to run the DDL once per table per process.
 */
public final class Migrations {
  private static final Logger logger = Logger.getLogger(Migrations.class.getName());

  private final JdbcTransactionManager txManager;
  private final Dialect dialect;
  private final Set<String> ensured = ConcurrentHashMap.newKeySet();

  public Migrations(ConnectionProvider connectionProvider, Dialect dialect) {
    this.txManager = new JdbcTransactionManager(
        Objects.requireNonNull(connectionProvider, "connectionProvider"));
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  /**
   * Creates the event table of the aggregate unless it already exists.
   *
   * @param aggregateName the aggregate name
   * @return the table name
   * @throws StorageException if the DDL fails
   */
  public String ensureSchema(String aggregateName) {
    String table = TableNames.forAggregate(aggregateName);
    if (ensured.contains(table)) {
      return table;
    }
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      for (String sql : dialect.createTableSql(table)) {
        JdbcTemplate.execute(tx.connection(), sql);
      }
      tx.commit();
    } catch (SQLException e) {
      throw new StorageException("Failed to create event table " + table, e);
    }
    ensured.add(table);
    logger.log(Level.INFO, "Ensured event table {0} ({1})", new Object[]{table, dialect.name()});
    return table;
  }

  /**
   * Whether this instance already ensured the table of the aggregate.
   */
  public boolean isEnsured(String aggregateName) {
    return ensured.contains(TableNames.forAggregate(aggregateName));
  }

  public Dialect dialect() {
    return dialect;
  }
}
