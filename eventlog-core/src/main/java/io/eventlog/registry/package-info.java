/**
 * Handler registries.
 *
 * <p>{@link io.eventlog.registry.HandlerRegistry} holds an atomically replaceable
 * {@link io.eventlog.registry.Handlers} snapshot of the transactional handlers,
 * post-commit handlers and event buses of one event store.
 */
package io.eventlog.registry;
