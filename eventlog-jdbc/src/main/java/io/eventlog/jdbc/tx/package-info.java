/**
 * Transaction management for the event store's own writes.
 *
 * @see io.eventlog.jdbc.tx.JdbcTransactionManager
 */
package io.eventlog.jdbc.tx;
