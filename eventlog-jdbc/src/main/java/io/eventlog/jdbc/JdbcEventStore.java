package io.eventlog.jdbc;

import io.eventlog.Aggregate;
import io.eventlog.AggregateState;
import io.eventlog.ConflictException;
import io.eventlog.EventAdmin;
import io.eventlog.EventBus;
import io.eventlog.EventHandler;
import io.eventlog.EventStore;
import io.eventlog.HandlerRejectedException;
import io.eventlog.PostCommitException;
import io.eventlog.StorageException;
import io.eventlog.StoreEvent;
import io.eventlog.TransactionalEventHandler;
import io.eventlog.codec.EventCodec;
import io.eventlog.jdbc.dialect.Dialects;
import io.eventlog.jdbc.spi.Dialect;
import io.eventlog.jdbc.tx.JdbcTransactionManager;
import io.eventlog.registry.HandlerRegistry;
import io.eventlog.registry.Handlers;
import io.eventlog.spi.ConnectionProvider;
import io.eventlog.spi.MetricsExporter;
import io.eventlog.util.EventIds;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC event store for one aggregate. Events live in table {@code <aggregate>_events}.
 *
 * <p>{@link #persist} runs the write protocol in a single transaction: insert every
 * new event, let each transactional handler see each event on the same connection,
 * then commit. A duplicate {@code (aggregate_id, sequence_number)} aborts with
 * {@link ConflictException}; a failing transactional handler aborts with
 * {@link HandlerRejectedException}. After the commit, post-commit handlers run per
 * event and event buses receive the whole batch. Their failures are collected and
 * reported together as a {@link PostCommitException}; the events stay committed.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * JdbcEventStore<CounterEvent> store = JdbcEventStore
 *     .builder("counter", JsonEventCodec.of(CounterEvent.class))
 *     .dataSource(dataSource)
 *     .addTransactionalHandler(counterProjection)
 *     .addEventHandler(notifier)
 *     .build();
 * }</pre>
 *
 * @param <E> the event type
 */
public final class JdbcEventStore<E> implements EventStore<E>, EventAdmin<E> {
  private static final Logger logger = Logger.getLogger(JdbcEventStore.class.getName());

  private final String aggregateName;
  private final String tableName;
  private final ConnectionProvider connectionProvider;
  private final JdbcTransactionManager txManager;
  private final Dialect dialect;
  private final EventCodec<E> codec;
  private final HandlerRegistry<E> handlers;
  private final MetricsExporter metrics;
  private final JdbcTemplate.RowMapper<StoreEvent<E>> rowMapper;

  private JdbcEventStore(Builder<E> builder, Dialect dialect) {
    this.aggregateName = builder.aggregateName;
    this.tableName = TableNames.forAggregate(builder.aggregateName);
    this.connectionProvider = builder.connectionProvider;
    this.txManager = new JdbcTransactionManager(builder.connectionProvider);
    this.dialect = dialect;
    this.codec = builder.codec;
    this.handlers = new HandlerRegistry<>(
        new Handlers<>(builder.transactionalHandlers, builder.eventHandlers, builder.eventBuses));
    this.metrics = builder.metrics;
    this.rowMapper = rs -> new StoreEvent<>(
        dialect.readUuid(rs, "id"),
        dialect.readUuid(rs, "aggregate_id"),
        codec.decode(rs.getString("payload")),
        dialect.readTimestamp(rs, "occurred_at"),
        rs.getLong("sequence_number"));
  }

  public static <E> Builder<E> builder(String aggregateName, EventCodec<E> codec) {
    return new Builder<>(aggregateName, codec);
  }

  public static <E> Builder<E> builder(Aggregate<?, ?, E> aggregate, EventCodec<E> codec) {
    Objects.requireNonNull(aggregate, "aggregate");
    return new Builder<>(aggregate.name(), codec);
  }

  public String aggregateName() {
    return aggregateName;
  }

  public String tableName() {
    return tableName;
  }

  public Dialect dialect() {
    return dialect;
  }

  /**
   * The live handler registry. Changes apply to {@code persist} calls that start afterwards.
   */
  public HandlerRegistry<E> handlers() {
    return handlers;
  }

  @Override
  public List<StoreEvent<E>> byAggregateId(UUID aggregateId) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    List<StoreEvent<E>> events;
    try (Connection conn = connectionProvider.getConnection()) {
      events = JdbcTemplate.query(conn, dialect.selectByAggregateIdSql(tableName), rowMapper,
          dialect.uuidParam(aggregateId));
    } catch (SQLException e) {
      throw new StorageException("Failed to load events of " + aggregateName + " " + aggregateId, e);
    }
    metrics.incrementEventsLoaded(aggregateName, events.size());
    logger.log(Level.FINE, "Loaded {0} event(s) of {1} {2}",
        new Object[]{events.size(), aggregateName, aggregateId});
    return events;
  }

  @Override
  public List<StoreEvent<E>> persist(AggregateState<?> state, List<E> newEvents) {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(newEvents, "newEvents");
    if (newEvents.isEmpty()) {
      return List.of();
    }
    Handlers<E> snapshot = handlers.snapshot();
    List<StoreEvent<E>> persisted = new ArrayList<>(newEvents.size());
    long start = System.nanoTime();

    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      Connection conn = tx.connection();
      long sequenceNumber = state.sequenceNumber();
      for (E payload : newEvents) {
        sequenceNumber++;
        StoreEvent<E> event = new StoreEvent<>(
            EventIds.next(), state.id(), payload, now(), sequenceNumber);
        insert(conn, event);
        persisted.add(event);
      }
      for (StoreEvent<E> event : persisted) {
        for (TransactionalEventHandler<E> handler : snapshot.transactional()) {
          applyTransactional(handler, event, conn);
        }
      }
      tx.commit();
    } catch (ConflictException e) {
      metrics.incrementConflicts(aggregateName);
      logger.log(Level.WARNING, e.getMessage());
      throw e;
    } catch (HandlerRejectedException e) {
      metrics.incrementHandlerRejections(aggregateName);
      logger.log(Level.WARNING, e.getMessage(), e.getCause());
      throw e;
    } catch (SQLException e) {
      throw new StorageException("Failed to persist events of " + aggregateName + " " + state.id(), e);
    }

    metrics.recordPersistLatencyMs(aggregateName,
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    metrics.incrementEventsPersisted(aggregateName, persisted.size());
    logger.log(Level.FINE, "Persisted {0} event(s) of {1} {2} up to sequence {3}",
        new Object[]{persisted.size(), aggregateName, state.id(),
            persisted.get(persisted.size() - 1).sequenceNumber()});

    List<StoreEvent<E>> committed = List.copyOf(persisted);
    List<Exception> failures = afterCommit(snapshot, committed);
    if (!failures.isEmpty()) {
      metrics.incrementPostCommitFailures(aggregateName, failures.size());
      throw new PostCommitException(committed, failures);
    }
    return committed;
  }

  @Override
  public void delete(UUID aggregateId) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    int deleted;
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      deleted = JdbcTemplate.update(tx.connection(), dialect.deleteByAggregateIdSql(tableName),
          dialect.uuidParam(aggregateId));
      tx.commit();
    } catch (SQLException e) {
      throw new StorageException("Failed to delete " + aggregateName + " " + aggregateId, e);
    }
    logger.log(Level.FINE, "Deleted {0} event(s) of {1} {2}",
        new Object[]{deleted, aggregateName, aggregateId});
  }

  @Override
  public Optional<StoreEvent<E>> findById(UUID eventId) {
    Objects.requireNonNull(eventId, "eventId");
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.queryOne(conn, dialect.selectByIdSql(tableName), rowMapper,
          dialect.uuidParam(eventId));
    } catch (SQLException e) {
      throw new StorageException("Failed to find event " + eventId + " of " + aggregateName, e);
    }
  }

  @Override
  public boolean updatePayload(UUID eventId, E payload) {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(payload, "payload");
    String json = codec.encode(payload);
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.update(conn, dialect.updatePayloadSql(tableName), json,
          dialect.uuidParam(eventId)) > 0;
    } catch (SQLException e) {
      throw new StorageException("Failed to update event " + eventId + " of " + aggregateName, e);
    }
  }

  @Override
  public boolean deleteById(UUID eventId) {
    Objects.requireNonNull(eventId, "eventId");
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.update(conn, dialect.deleteByIdSql(tableName),
          dialect.uuidParam(eventId)) > 0;
    } catch (SQLException e) {
      throw new StorageException("Failed to delete event " + eventId + " of " + aggregateName, e);
    }
  }

  private void insert(Connection conn, StoreEvent<E> event) throws SQLException {
    String payload = codec.encode(event.payload());
    try {
      JdbcTemplate.updateChecked(conn, dialect.insertSql(tableName),
          dialect.uuidParam(event.id()),
          dialect.uuidParam(event.aggregateId()),
          payload,
          dialect.timestampParam(event.occurredAt()),
          event.sequenceNumber());
    } catch (SQLException e) {
      if (dialect.isUniqueViolation(e)) {
        throw new ConflictException(event.aggregateId(), event.sequenceNumber(), e);
      }
      throw e;
    }
  }

  private static <E> void applyTransactional(TransactionalEventHandler<E> handler,
      StoreEvent<E> event, Connection conn) {
    try {
      handler.handle(event, conn);
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      throw new HandlerRejectedException(handler.name(), event, e);
    }
  }

  private List<Exception> afterCommit(Handlers<E> snapshot, List<StoreEvent<E>> committed) {
    List<Exception> failures = new ArrayList<>();
    for (StoreEvent<E> event : committed) {
      for (EventHandler<E> handler : snapshot.eventHandlers()) {
        try {
          handler.handle(event);
        } catch (Exception e) {
          restoreInterrupt(e);
          logger.log(Level.WARNING, "Post-commit handler " + handler.name() + " failed for event "
              + event.id() + " of " + aggregateName + " " + event.aggregateId(), e);
          failures.add(e);
        }
      }
    }
    for (EventBus<E> bus : snapshot.eventBuses()) {
      try {
        bus.publish(committed);
      } catch (Exception e) {
        restoreInterrupt(e);
        logger.log(Level.WARNING, "Event bus " + bus.name() + " failed to publish "
            + committed.size() + " event(s) of " + aggregateName, e);
        failures.add(e);
      }
    }
    return failures;
  }

  private static void restoreInterrupt(Exception e) {
    if (e instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
  }

  // Columns keep microseconds at most; stored instants read back equal
  private static Instant now() {
    return Instant.now().truncatedTo(ChronoUnit.MICROS);
  }

  /**
   * Builder for {@link JdbcEventStore}. Single use.
   *
   * @param <E> the event type
   */
  public static final class Builder<E> {
    private final String aggregateName;
    private final EventCodec<E> codec;
    private ConnectionProvider connectionProvider;
    private Dialect dialect;
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private Migrations migrations;
    private boolean runMigrations = true;
    private final List<TransactionalEventHandler<E>> transactionalHandlers = new ArrayList<>();
    private final List<EventHandler<E>> eventHandlers = new ArrayList<>();
    private final List<EventBus<E>> eventBuses = new ArrayList<>();
    private boolean built;

    private Builder(String aggregateName, EventCodec<E> codec) {
      this.aggregateName = Objects.requireNonNull(aggregateName, "aggregateName");
      this.codec = Objects.requireNonNull(codec, "codec");
    }

    public Builder<E> connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder<E> dataSource(DataSource dataSource) {
      this.connectionProvider = new DataSourceConnectionProvider(dataSource);
      return this;
    }

    /**
     * Sets the dialect. When unset it is detected from the connection URL.
     */
    public Builder<E> dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    public Builder<E> metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Uses a shared {@link Migrations} instance instead of a private one.
     */
    public Builder<E> migrations(Migrations migrations) {
      this.migrations = migrations;
      return this;
    }

    /**
     * Skips the schema step in {@link #build()}. The table must already exist.
     */
    public Builder<E> withoutRunningMigrations() {
      this.runMigrations = false;
      return this;
    }

    public Builder<E> addTransactionalHandler(TransactionalEventHandler<E> handler) {
      transactionalHandlers.add(Objects.requireNonNull(handler, "handler"));
      return this;
    }

    public Builder<E> transactionalHandlers(List<TransactionalEventHandler<E>> handlers) {
      transactionalHandlers.clear();
      transactionalHandlers.addAll(handlers);
      return this;
    }

    public Builder<E> addEventHandler(EventHandler<E> handler) {
      eventHandlers.add(Objects.requireNonNull(handler, "handler"));
      return this;
    }

    public Builder<E> eventHandlers(List<EventHandler<E>> handlers) {
      eventHandlers.clear();
      eventHandlers.addAll(handlers);
      return this;
    }

    public Builder<E> addEventBus(EventBus<E> bus) {
      eventBuses.add(Objects.requireNonNull(bus, "bus"));
      return this;
    }

    public Builder<E> eventBuses(List<EventBus<E>> buses) {
      eventBuses.clear();
      eventBuses.addAll(buses);
      return this;
    }

    /**
     * Builds the store and, unless disabled, ensures its table exists.
     *
     * @throws IllegalStateException if this builder was already used
     */
    public JdbcEventStore<E> build() {
      if (built) {
        throw new IllegalStateException("Builder already used");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(metrics, "metrics");
      built = true;
      Dialect resolved = dialect != null ? dialect : Dialects.detect(connectionProvider);
      JdbcEventStore<E> store = new JdbcEventStore<>(this, resolved);
      if (runMigrations) {
        Migrations schema = migrations != null ? migrations : new Migrations(connectionProvider, resolved);
        schema.ensureSchema(aggregateName);
      }
      return store;
    }
  }
}
