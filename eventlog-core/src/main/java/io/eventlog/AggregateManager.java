package io.eventlog;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs commands against an aggregate: decide, persist, fold.
 *
 * <p>The manager bridges the pure {@link Aggregate} and its {@link EventStore}. It
 * holds no state of its own and is safe to share between threads and between
 * policies. Concurrent commands on the same aggregate are arbitrated by the store;
 * the loser gets a {@link ConflictException} and should reload and retry.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * AggregateManager<Integer, CounterCommand, CounterEvent> manager =
 *     new AggregateManager<>(new CounterAggregate(), store);
 *
 * AggregateState<Integer> state = manager.load(counterId);
 * state = manager.handleCommand(state, CounterCommand.INCREMENT);
 * }</pre>
 *
 * @param <S> the folded state type
 * @param <C> the command type
 * @param <E> the event type
 */
public final class AggregateManager<S, C, E> {
  private static final Logger logger = Logger.getLogger(AggregateManager.class.getName());

  private final Aggregate<S, C, E> aggregate;
  private final EventStore<E> eventStore;

  public AggregateManager(Aggregate<S, C, E> aggregate, EventStore<E> eventStore) {
    this.aggregate = Objects.requireNonNull(aggregate, "aggregate");
    this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
  }

  public Aggregate<S, C, E> aggregate() {
    return aggregate;
  }

  public EventStore<E> eventStore() {
    return eventStore;
  }

  /**
   * Rebuilds an aggregate by replaying its log.
   *
   * @param aggregateId the aggregate id
   * @return the folded state, or a fresh state at sequence number 0 if the aggregate has no events
   */
  public AggregateState<S> load(UUID aggregateId) {
    List<StoreEvent<E>> events = eventStore.byAggregateId(aggregateId);
    AggregateState<S> state = fold(AggregateState.withId(aggregateId, aggregate.initialState()), events);
    if (logger.isLoggable(Level.FINE)) {
      logger.log(Level.FINE, "Loaded {0} {1} at sequence {2}",
          new Object[] {aggregate.name(), aggregateId, state.sequenceNumber()});
    }
    return state;
  }

  /**
   * Creates a fresh state with a random id, without touching the store.
   */
  public AggregateState<S> newState() {
    return AggregateState.create(aggregate.initialState());
  }

  /**
   * Decides a command against {@code state}, persists the resulting events and
   * returns the state with them folded in.
   *
   * @param state   the state to decide against; never modified
   * @param command the command
   * @return the new state
   * @throws DomainException          if the aggregate rejected the command; nothing was persisted
   * @throws ConflictException        if {@code state} is stale; reload and retry
   * @throws HandlerRejectedException if a transactional handler vetoed the write
   * @throws PostCommitException      if the events committed but post-commit work failed;
   *                                  {@link PostCommitException#aggregateState()} holds the new state
   */
  public AggregateState<S> handleCommand(AggregateState<S> state, C command) {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(command, "command");
    List<E> events = aggregate.handleCommand(state.inner(), command);
    if (events == null || events.isEmpty()) {
      return state;
    }
    List<StoreEvent<E>> persisted;
    try {
      persisted = eventStore.persist(state, events);
    } catch (PostCommitException e) {
      List<StoreEvent<E>> committed = e.committedEvents();
      throw e.withAggregateState(fold(state, committed));
    }
    return fold(state, persisted);
  }

  /**
   * Loads the aggregate and runs a command against it.
   *
   * @see #handleCommand(AggregateState, Object)
   */
  public AggregateState<S> handleCommand(UUID aggregateId, C command) {
    return handleCommand(load(aggregateId), command);
  }

  /**
   * Deletes the aggregate's whole log.
   */
  public void delete(UUID aggregateId) {
    eventStore.delete(aggregateId);
  }

  /**
   * Folds events into a state, in the order given.
   *
   * @param state  the starting state
   * @param events events ordered by sequence number
   * @return the state after the last event
   */
  public AggregateState<S> fold(AggregateState<S> state, List<StoreEvent<E>> events) {
    S inner = state.inner();
    long sequenceNumber = state.sequenceNumber();
    for (StoreEvent<E> event : events) {
      if (event.sequenceNumber() <= sequenceNumber) {
        throw new IllegalStateException("Event " + event.id() + " has sequence number "
            + event.sequenceNumber() + " but state is already at " + sequenceNumber);
      }
      inner = aggregate.applyEvent(inner, event.payload());
      sequenceNumber = event.sequenceNumber();
    }
    return events.isEmpty() ? state : state.applied(inner, sequenceNumber);
  }
}
