package io.eventlog.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.eventlog.Aggregate;
import io.eventlog.codec.EventCodec;
import io.eventlog.codec.JsonEventCodec;
import io.eventlog.jdbc.dialect.Dialects;
import io.eventlog.jdbc.spi.Dialect;
import io.eventlog.spi.ConnectionProvider;
import io.eventlog.spi.MetricsExporter;

import java.util.Objects;

/**
 * Process-wide entry point that hands out preconfigured {@link JdbcEventStore} builders.
 *
 * <p>Holds the connection provider, dialect, metrics exporter, JSON mapper and one
 * shared {@link Migrations}, so every store built from the same factory creates its
 * table at most once.
 *
 * <pre>{@code
 * JdbcEventStoreFactory factory = new JdbcEventStoreFactory(
 *     new DataSourceConnectionProvider(dataSource));
 * JdbcEventStore<OrderEvent> orders = factory.builder(new OrderAggregate(), OrderEvent.class)
 *     .addTransactionalHandler(orderProjection)
 *     .build();
 * }</pre>
 */
public final class JdbcEventStoreFactory {
  private final ConnectionProvider connectionProvider;
  private final Dialect dialect;
  private final MetricsExporter metrics;
  private final ObjectMapper objectMapper;
  private final boolean runMigrations;
  private final Migrations migrations;

  public JdbcEventStoreFactory(ConnectionProvider connectionProvider) {
    this(connectionProvider, Dialects.detect(connectionProvider), MetricsExporter.NOOP,
        JsonEventCodec.defaultMapper(), true);
  }

  public JdbcEventStoreFactory(ConnectionProvider connectionProvider, Dialect dialect,
      MetricsExporter metrics, ObjectMapper objectMapper, boolean runMigrations) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.runMigrations = runMigrations;
    this.migrations = new Migrations(connectionProvider, dialect);
  }

  /**
   * Builder for the given aggregate name and codec, prefilled with this factory's settings.
   */
  public <E> JdbcEventStore.Builder<E> builder(String aggregateName, EventCodec<E> codec) {
    JdbcEventStore.Builder<E> builder = JdbcEventStore.builder(aggregateName, codec)
        .connectionProvider(connectionProvider)
        .dialect(dialect)
        .metrics(metrics)
        .migrations(migrations);
    if (!runMigrations) {
      builder.withoutRunningMigrations();
    }
    return builder;
  }

  /**
   * Builder for the aggregate, encoding events as JSON with this factory's mapper.
   */
  public <E> JdbcEventStore.Builder<E> builder(Aggregate<?, ?, E> aggregate, Class<E> eventType) {
    Objects.requireNonNull(aggregate, "aggregate");
    return builder(aggregate.name(), JsonEventCodec.of(objectMapper, eventType));
  }

  public ConnectionProvider connectionProvider() {
    return connectionProvider;
  }

  public Dialect dialect() {
    return dialect;
  }

  public MetricsExporter metrics() {
    return metrics;
  }

  public ObjectMapper objectMapper() {
    return objectMapper;
  }

  public boolean runMigrations() {
    return runMigrations;
  }

  public Migrations migrations() {
    return migrations;
  }
}
