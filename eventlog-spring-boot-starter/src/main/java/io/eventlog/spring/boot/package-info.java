/**
 * Spring Boot auto-configuration for the event store.
 *
 * <p>Properties live under the {@code eventlog} prefix; see
 * {@link io.eventlog.spring.boot.EventLogProperties}.
 */
package io.eventlog.spring.boot;
