/**
 * Built-in database dialects and the {@link io.eventlog.jdbc.dialect.Dialects} registry.
 */
package io.eventlog.jdbc.dialect;
