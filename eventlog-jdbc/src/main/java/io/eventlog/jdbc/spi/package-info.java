/**
 * Service provider interfaces of the JDBC event store.
 *
 * <ul>
 *   <li>{@link io.eventlog.jdbc.spi.Dialect} - database-specific SQL and type handling</li>
 * </ul>
 */
package io.eventlog.jdbc.spi;
