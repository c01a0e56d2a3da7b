package io.eventlog;

import java.sql.Connection;

/**
 * Handler that runs inside the write transaction, after the events are inserted
 * and before the commit.
 *
 * <p>Use it to keep synchronous read models consistent with the log: rows written
 * through the supplied connection commit together with the events. Throwing from
 * {@link #handle} vetoes the write; the whole batch rolls back and the caller
 * receives a {@link HandlerRejectedException}.
 *
 * <p>Do not commit, roll back or close the connection.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * TransactionalEventHandler<CounterEvent> projection = (event, conn) -> {
 *   try (PreparedStatement ps = conn.prepareStatement(
 *       "UPDATE counters SET count = count + 1 WHERE counter_id = ?")) {
 *     ps.setObject(1, event.aggregateId());
 *     ps.executeUpdate();
 *   }
 * };
 * }</pre>
 *
 * @param <E> the event type
 * @see EventHandler
 */
@FunctionalInterface
public interface TransactionalEventHandler<E> {

  /**
   * Handles one persisted, not yet committed event.
   *
   * @param event      the event
   * @param connection the connection of the open write transaction
   * @throws Exception to veto the write
   */
  void handle(StoreEvent<E> event, Connection connection) throws Exception;

  /**
   * Name used in logs and in {@link HandlerRejectedException} messages.
   */
  default String name() {
    return getClass().getSimpleName();
  }
}
