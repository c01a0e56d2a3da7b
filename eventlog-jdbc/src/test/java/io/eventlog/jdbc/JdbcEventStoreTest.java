package io.eventlog.jdbc;

import io.eventlog.AggregateManager;
import io.eventlog.AggregateState;
import io.eventlog.ConflictException;
import io.eventlog.EventBus;
import io.eventlog.EventHandler;
import io.eventlog.HandlerRejectedException;
import io.eventlog.PostCommitException;
import io.eventlog.StoreEvent;
import io.eventlog.TransactionalEventHandler;
import io.eventlog.codec.JsonEventCodec;
import io.eventlog.jdbc.dialect.H2Dialect;
import io.eventlog.jdbc.fixtures.Counter;
import io.eventlog.jdbc.fixtures.Counter.Command;
import io.eventlog.jdbc.fixtures.Counter.Event;
import io.eventlog.jdbc.fixtures.H2;
import io.eventlog.jdbc.fixtures.RecordingMetrics;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class JdbcEventStoreTest {
  private JdbcDataSource dataSource;
  private RecordingMetrics metrics;
  private JdbcEventStore<Event> store;
  private AggregateManager<Integer, Command, Event> manager;

  @BeforeEach
  void setUp() {
    dataSource = H2.dataSource("store");
    metrics = new RecordingMetrics();
    store = JdbcEventStore.builder(new Counter(), JsonEventCodec.of(Event.class))
        .dataSource(dataSource)
        .metrics(metrics)
        .build();
    manager = new AggregateManager<>(new Counter(), store);
  }

  @Test
  void storesEventsInPerAggregateTable() throws Exception {
    assertEquals("counter_events", store.tableName());
    assertInstanceOf(H2Dialect.class, store.dialect());

    manager.handleCommand(manager.newState(), Command.INCREMENT);

    assertEquals(1, H2.count(dataSource, "SELECT COUNT(*) FROM counter_events"));
  }

  @Test
  void incrementThenDecrementFromFreshId() {
    AggregateState<Integer> state = manager.load(UUID.randomUUID());

    state = manager.handleCommand(state, Command.INCREMENT);
    state = manager.handleCommand(state, Command.DECREMENT);

    assertEquals(0, state.inner());
    assertEquals(2, state.sequenceNumber());
    List<StoreEvent<Event>> events = store.byAggregateId(state.id());
    assertEquals(List.of(1L, 2L), events.stream().map(StoreEvent::sequenceNumber).toList());
    assertEquals(List.of(Event.INCREMENTED, Event.DECREMENTED), events.stream().map(StoreEvent::payload).toList());
    assertEquals(state, manager.load(state.id()));
  }

  @Test
  void persistReturnsStoredEnvelopes() {
    AggregateState<Integer> state = manager.newState();

    List<StoreEvent<Event>> persisted = store.persist(state, List.of(Event.INCREMENTED, Event.INCREMENTED));

    assertEquals(2, persisted.size());
    assertEquals(1, persisted.get(0).sequenceNumber());
    assertEquals(2, persisted.get(1).sequenceNumber());
    assertNotEquals(persisted.get(0).id(), persisted.get(1).id());
    assertEquals(persisted, store.byAggregateId(state.id()));
    assertEquals(2, metrics.persisted.get());
    assertEquals(1, metrics.latencies.get());
  }

  @Test
  void emptyBatchIsNoOp() throws Exception {
    List<StoreEvent<Event>> persisted = store.persist(manager.newState(), List.of());

    assertTrue(persisted.isEmpty());
    assertEquals(0, H2.count(dataSource, "SELECT COUNT(*) FROM counter_events"));
  }

  @Test
  void unknownAggregateHasNoEvents() {
    assertTrue(store.byAggregateId(UUID.randomUUID()).isEmpty());
  }

  @Test
  void concurrentWritersAtSameSequenceConflict() {
    AggregateState<Integer> state = manager.newState();
    for (int i = 0; i < 5; i++) {
      state = manager.handleCommand(state, Command.INCREMENT);
    }
    assertEquals(5, state.sequenceNumber());

    AggregateState<Integer> winner = manager.handleCommand(state, Command.INCREMENT);
    AggregateState<Integer> stale = state;
    ConflictException e = assertThrows(ConflictException.class,
        () -> manager.handleCommand(stale, Command.DECREMENT));

    assertEquals(6, winner.sequenceNumber());
    assertEquals(state.id(), e.aggregateId());
    assertEquals(6, e.sequenceNumber());
    assertEquals(6, store.byAggregateId(state.id()).size());
    assertEquals(6, manager.load(state.id()).inner());
    assertEquals(1, metrics.conflicts.get());
  }

  @Test
  void conflictRollsBackWholeBatch() {
    AggregateState<Integer> state = manager.newState();
    manager.handleCommand(state, Command.INCREMENT);

    // stale state at 0 tries to write 1 and 2
    assertThrows(ConflictException.class, () -> manager.handleCommand(state, Command.INCREMENT_TWICE));

    assertEquals(1, store.byAggregateId(state.id()).size());
  }

  @Test
  void failingTransactionalHandlerLeavesLogUnchanged() {
    AggregateState<Integer> state = manager.handleCommand(manager.newState(), Command.INCREMENT);
    List<StoreEvent<Event>> seen = new ArrayList<>();
    store.handlers().addTransactionalHandler(new TransactionalEventHandler<>() {
      @Override
      public void handle(StoreEvent<Event> event, java.sql.Connection connection) {
        seen.add(event);
        throw new IllegalStateException("vetoed");
      }

      @Override
      public String name() {
        return "veto";
      }
    });

    HandlerRejectedException e = assertThrows(HandlerRejectedException.class,
        () -> manager.handleCommand(state, Command.INCREMENT));

    assertEquals("veto", e.handlerName());
    assertEquals(2, e.event().sequenceNumber());
    assertEquals("vetoed", e.getCause().getMessage());
    assertEquals(1, seen.size());
    assertEquals(1, store.byAggregateId(state.id()).size());
    assertEquals(1, metrics.rejections.get());
  }

  @Test
  void transactionalHandlersSeeEachEventInOrder() {
    List<String> calls = new ArrayList<>();
    store.handlers()
        .addTransactionalHandler((event, conn) -> calls.add("first:" + event.sequenceNumber()))
        .addTransactionalHandler((event, conn) -> calls.add("second:" + event.sequenceNumber()));

    manager.handleCommand(manager.newState(), Command.INCREMENT_TWICE);

    assertEquals(List.of("first:1", "second:1", "first:2", "second:2"), calls);
  }

  @Test
  void postCommitFailureKeepsEventsAndRunsRemainingHandlers() {
    List<String> calls = new CopyOnWriteArrayList<>();
    store.handlers()
        .addEventHandler(event -> {
          calls.add("mailer");
          throw new IOException("smtp down");
        })
        .addEventHandler(event -> calls.add("audit"))
        .addEventBus(events -> calls.add("bus:" + events.size()));
    AggregateState<Integer> state = manager.newState();

    PostCommitException e = assertThrows(PostCommitException.class,
        () -> manager.handleCommand(state, Command.INCREMENT));

    assertEquals(List.of("mailer", "audit", "bus:1"), calls);
    assertEquals(1, e.failures().size());
    assertInstanceOf(IOException.class, e.getCause());
    assertEquals(1, e.committedEvents().size());
    AggregateState<Integer> folded = e.aggregateState();
    assertEquals(1, folded.inner());
    assertEquals(1, store.byAggregateId(state.id()).size());
    assertEquals(1, metrics.postCommitFailures.get());
  }

  @Test
  void everyPostCommitFailureIsReported() {
    store.handlers()
        .addEventHandler(event -> {
          throw new IllegalStateException("handler");
        })
        .addEventBus(events -> {
          throw new IOException("bus");
        });

    PostCommitException e = assertThrows(PostCommitException.class,
        () -> store.persist(manager.newState(), List.of(Event.INCREMENTED, Event.INCREMENTED)));

    // handler fails once per event, bus once per batch
    assertEquals(3, e.failures().size());
    assertEquals("bus", e.failures().get(2).getMessage());
    assertEquals(3, metrics.postCommitFailures.get());
  }

  @Test
  void busReceivesWholeBatchOnce() {
    List<List<StoreEvent<Event>>> batches = new ArrayList<>();
    store.handlers().addEventBus(batches::add);

    List<StoreEvent<Event>> persisted = store.persist(manager.newState(),
        List.of(Event.INCREMENTED, Event.INCREMENTED, Event.DECREMENTED));

    assertEquals(1, batches.size());
    assertEquals(persisted, batches.get(0));
  }

  @Test
  void postCommitHandlersRunPerEvent() {
    List<Long> sequences = new ArrayList<>();
    store.handlers().addEventHandler(event -> sequences.add(event.sequenceNumber()));

    manager.handleCommand(manager.newState(), Command.INCREMENT_TWICE);

    assertEquals(List.of(1L, 2L), sequences);
  }

  @Test
  void replacingHandlersAffectsLaterWritesOnly() {
    List<String> calls = new ArrayList<>();
    EventHandler<Event> before = event -> calls.add("before");
    EventHandler<Event> after = event -> calls.add("after");
    store.handlers().setEventHandlers(List.of(before));

    manager.handleCommand(manager.newState(), Command.INCREMENT);
    store.handlers().setEventHandlers(List.of(after));
    manager.handleCommand(manager.newState(), Command.INCREMENT);

    assertEquals(List.of("before", "after"), calls);
  }

  @Test
  void handlerRegisteredMidWriteWaitsForNextWrite() {
    List<String> calls = new ArrayList<>();
    EventBus<Event> late = events -> calls.add("late");
    store.handlers().addEventHandler(event -> {
      calls.add("registering");
      store.handlers().addEventBus(late);
    });

    manager.handleCommand(manager.newState(), Command.INCREMENT);
    assertEquals(List.of("registering"), calls);

    store.handlers().setEventHandlers(List.of());
    manager.handleCommand(manager.newState(), Command.INCREMENT);
    assertEquals(List.of("registering", "late"), calls);
  }

  @Test
  void releaseFailureAfterCommitStillRunsPostCommitWork() throws Exception {
    List<Long> handled = new CopyOnWriteArrayList<>();
    List<Integer> published = new CopyOnWriteArrayList<>();
    JdbcEventStore<Event> flaky = JdbcEventStore.builder(new Counter(), JsonEventCodec.of(Event.class))
        .connectionProvider(H2.failingOnClose(dataSource))
        .dialect(new H2Dialect())
        .addEventHandler(event -> handled.add(event.sequenceNumber()))
        .addEventBus(batch -> published.add(batch.size()))
        .build();
    AggregateState<Integer> state = manager.newState();

    List<StoreEvent<Event>> persisted = flaky.persist(state, List.of(Event.INCREMENTED, Event.INCREMENTED));

    assertEquals(2, persisted.size());
    assertEquals(List.of(1L, 2L), handled);
    assertEquals(List.of(2), published);
    assertEquals(persisted, store.byAggregateId(state.id()));
  }

  @Test
  void deleteRemovesEveryEventOfAggregate() {
    AggregateState<Integer> state = manager.handleCommand(manager.newState(), Command.INCREMENT_TWICE);
    AggregateState<Integer> other = manager.handleCommand(manager.newState(), Command.INCREMENT);

    manager.delete(state.id());

    assertTrue(store.byAggregateId(state.id()).isEmpty());
    assertEquals(1, store.byAggregateId(other.id()).size());
  }

  @Test
  void loadCountsEvents() {
    AggregateState<Integer> state = manager.handleCommand(manager.newState(), Command.INCREMENT_TWICE);

    manager.load(state.id());

    assertEquals(2, metrics.loaded.get());
  }

  @Test
  void builderIsSingleUse() {
    JdbcEventStore.Builder<Event> builder = JdbcEventStore.builder("counter", JsonEventCodec.of(Event.class))
        .dataSource(dataSource);
    builder.build();

    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void builderRequiresConnectionProvider() {
    assertThrows(NullPointerException.class,
        () -> JdbcEventStore.builder("counter", JsonEventCodec.of(Event.class)).build());
  }

  @Test
  void builderRejectsInvalidAggregateName() {
    assertThrows(IllegalArgumentException.class,
        () -> JdbcEventStore.builder("bad-name", JsonEventCodec.of(Event.class))
            .dataSource(dataSource)
            .build());
  }

  @Test
  void builderRegistersHandlersInOrder() {
    List<String> calls = new ArrayList<>();
    JdbcEventStore<Event> configured = JdbcEventStore.builder(new Counter(), JsonEventCodec.of(Event.class))
        .dataSource(dataSource)
        .dialect(new H2Dialect())
        .addTransactionalHandler((event, conn) -> calls.add("tx"))
        .addEventHandler(event -> calls.add("handler"))
        .addEventBus(events -> calls.add("bus"))
        .build();

    configured.persist(AggregateState.create(0), List.of(Event.INCREMENTED));

    assertEquals(List.of("tx", "handler", "bus"), calls);
    assertEquals(1, configured.handlers().snapshot().transactional().size());
  }
}
