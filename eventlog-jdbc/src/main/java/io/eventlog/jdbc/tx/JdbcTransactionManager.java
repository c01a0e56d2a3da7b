package io.eventlog.jdbc.tx;

import io.eventlog.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight transaction manager for the event store's own writes. Obtains a
 * connection and disables auto-commit for the lifetime of a {@link Transaction}.
 *
 * <p>Use via try-with-resources on the returned {@link Transaction}:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     insertEvents(tx.connection());
 *     tx.commit();
 * }
 * }</pre>
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;

  public JdbcTransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * Begins a new transaction on a fresh connection.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return new Transaction(connection);
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} triggers a rollback automatically.
   * The connection is returned to its provider once the transaction completes.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private boolean completed;

    private Transaction(Connection connection) {
      this.connection = connection;
    }

    /**
     * The connection bound to this transaction.
     *
     * @throws IllegalStateException if the transaction already completed
     */
    public Connection connection() {
      if (completed) {
        throw new IllegalStateException("Transaction already completed");
      }
      return connection;
    }

    public boolean isCompleted() {
      return completed;
    }

    /**
     * Commits. Once the database has accepted the commit the data is durable, so a
     * failure to restore auto-commit or to release the connection is only logged.
     *
     * @throws SQLException if the commit itself fails; the transaction is rolled back
     */
    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        safeRollback(e);
        finalizeTx(e);
        throw e;
      }
      try {
        finalizeTx(null);
      } catch (SQLException e) {
        logger.log(Level.WARNING, "Committed, but failed to release the connection", e);
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } catch (SQLException e) {
        finalizeTx(e);
        throw e;
      }
      finalizeTx(null);
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finalizeTx(SQLException pending) throws SQLException {
      completed = true;
      SQLException failure = null;
      try {
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        failure = e;
      } finally {
        try {
          connection.close();
        } catch (SQLException e) {
          if (failure == null) failure = e; else failure.addSuppressed(e);
        }
      }
      if (failure != null) {
        if (pending != null) {
          pending.addSuppressed(failure);
        } else {
          throw failure;
        }
      }
    }

    private void safeRollback(SQLException pending) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        pending.addSuppressed(e);
      }
    }
  }
}
