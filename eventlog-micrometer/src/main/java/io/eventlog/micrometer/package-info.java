/**
 * Micrometer integration for event store metrics.
 *
 * @see io.eventlog.micrometer.MicrometerMetricsExporter
 */
package io.eventlog.micrometer;
