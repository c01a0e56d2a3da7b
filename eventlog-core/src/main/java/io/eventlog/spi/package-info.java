/**
 * Service provider interfaces implemented outside the core module.
 *
 * <ul>
 *   <li>{@link io.eventlog.spi.ConnectionProvider}: JDBC connections for event stores</li>
 *   <li>{@link io.eventlog.spi.MetricsExporter}: metrics backend bridge</li>
 * </ul>
 */
package io.eventlog.spi;
