/**
 * JDBC implementation of the event store.
 *
 * <p>{@link io.eventlog.jdbc.JdbcEventStore} stores one aggregate per table
 * ({@code <aggregate>_events}) and runs the transactional write protocol.
 * Database differences live in {@link io.eventlog.jdbc.spi.Dialect} implementations;
 * tables are created by {@link io.eventlog.jdbc.Migrations}.
 *
 * @see io.eventlog.jdbc.JdbcEventStore
 * @see io.eventlog.jdbc.JdbcEventStoreFactory
 * @see io.eventlog.jdbc.dialect.Dialects
 */
package io.eventlog.jdbc;
