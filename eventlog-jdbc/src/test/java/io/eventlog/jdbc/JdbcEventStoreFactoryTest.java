package io.eventlog.jdbc;

import io.eventlog.AggregateManager;
import io.eventlog.AggregateState;
import io.eventlog.codec.JsonEventCodec;
import io.eventlog.jdbc.dialect.H2Dialect;
import io.eventlog.jdbc.fixtures.Counter;
import io.eventlog.jdbc.fixtures.Counter.Command;
import io.eventlog.jdbc.fixtures.Counter.Event;
import io.eventlog.jdbc.fixtures.H2;
import io.eventlog.jdbc.fixtures.RecordingMetrics;
import io.eventlog.jdbc.fixtures.Saga;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JdbcEventStoreFactoryTest {
  private JdbcDataSource dataSource;

  @BeforeEach
  void setUp() {
    dataSource = H2.dataSource("factory");
  }

  @Test
  void detectsDialectAndDefaults() {
    JdbcEventStoreFactory factory = new JdbcEventStoreFactory(new DataSourceConnectionProvider(dataSource));

    assertInstanceOf(H2Dialect.class, factory.dialect());
    assertTrue(factory.runMigrations());
    assertNotNull(factory.objectMapper());
  }

  @Test
  void storesShareSettingsAndMigrations() throws Exception {
    RecordingMetrics metrics = new RecordingMetrics();
    JdbcEventStoreFactory factory = new JdbcEventStoreFactory(new DataSourceConnectionProvider(dataSource),
        new H2Dialect(), metrics, JsonEventCodec.defaultMapper(), true);

    JdbcEventStore<Event> counters = factory.builder(new Counter(), Event.class).build();
    JdbcEventStore<Saga.Event> sagas = factory.builder(new Saga(), Saga.Event.class).build();

    assertTrue(factory.migrations().isEnsured("counter"));
    assertTrue(factory.migrations().isEnsured("saga"));
    assertTrue(H2.tableExists(dataSource, "saga_events"));

    AggregateManager<Integer, Command, Event> manager = new AggregateManager<>(new Counter(), counters);
    AggregateState<Integer> state = manager.handleCommand(manager.newState(), Command.INCREMENT);
    assertEquals(1, state.inner());
    assertEquals(1, metrics.persisted.get());
    assertEquals("saga_events", sagas.tableName());
  }

  @Test
  void migrationsCanBeDisabled() throws Exception {
    JdbcEventStoreFactory factory = new JdbcEventStoreFactory(new DataSourceConnectionProvider(dataSource),
        new H2Dialect(), new RecordingMetrics(), JsonEventCodec.defaultMapper(), false);

    factory.builder(new Counter(), Event.class).build();

    assertFalse(H2.tableExists(dataSource, "counter_events"));
  }

  @Test
  void nullArgumentsThrow() {
    var provider = new DataSourceConnectionProvider(dataSource);
    assertThrows(NullPointerException.class, () ->
        new JdbcEventStoreFactory(provider, null, new RecordingMetrics(), JsonEventCodec.defaultMapper(), true));
    assertThrows(NullPointerException.class, () ->
        new JdbcEventStoreFactory(provider, new H2Dialect(), null, JsonEventCodec.defaultMapper(), true));
  }
}
