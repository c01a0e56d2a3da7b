/**
 * Root API of eventlog: an event-sourcing storage engine with transactional
 * projections, post-commit handlers and policies.
 *
 * <h2>Core Design</h2>
 * <p>An {@link io.eventlog.Aggregate} decides commands into events and folds events
 * into state, without I/O. An {@link io.eventlog.EventStore} persists each
 * aggregate's events in an append-only log keyed by
 * {@code (aggregateId, sequenceNumber)}; that uniqueness constraint is the only
 * concurrency guard. The {@link io.eventlog.AggregateManager} ties the two together.
 *
 * <p>Three kinds of collaborators react to new events:
 * <ul>
 *   <li>{@link io.eventlog.TransactionalEventHandler}: inside the write transaction, can veto it</li>
 *   <li>{@link io.eventlog.EventHandler} and {@link io.eventlog.Policy}: after commit, cannot veto</li>
 *   <li>{@link io.eventlog.EventBus}: after commit, receives the whole batch</li>
 * </ul>
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>eventlog-core</b>: aggregate contract, manager, handlers, registries, codecs</li>
 *   <li><b>eventlog-jdbc</b>: {@linkplain io.eventlog.jdbc JDBC event store} (H2, MySQL, PostgreSQL)</li>
 *   <li><b>eventlog-micrometer</b>: Micrometer metrics</li>
 *   <li><b>eventlog-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * JdbcEventStore<CounterEvent> store = JdbcEventStore.builder("counter", JsonEventCodec.of(CounterEvent.class))
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .addTransactionalHandler(counterProjection)
 *     .addEventHandler(notifier)
 *     .build();
 *
 * var manager = new AggregateManager<>(new CounterAggregate(), store);
 * AggregateState<Integer> state = manager.handleCommand(manager.newState(), CounterCommand.INCREMENT);
 * }</pre>
 *
 * @see io.eventlog.Aggregate
 * @see io.eventlog.AggregateManager
 * @see io.eventlog.EventStore
 */
package io.eventlog;
