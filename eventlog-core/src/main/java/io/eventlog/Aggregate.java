package io.eventlog;

import java.util.List;

/**
 * Pure decision logic for one kind of aggregate.
 *
 * <p>An aggregate turns a command into events ({@link #handleCommand}) and folds
 * events into state ({@link #applyEvent}). Both operations must be deterministic
 * and free of I/O: everything that touches storage or the outside world lives in
 * the {@link EventStore} and in the handlers registered on it.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * public final class CounterAggregate implements Aggregate<Integer, CounterCommand, CounterEvent> {
 *   public String name() { return "counter"; }
 *   public Integer initialState() { return 0; }
 *
 *   public List<CounterEvent> handleCommand(Integer state, CounterCommand command) {
 *     return switch (command) {
 *       case INCREMENT -> List.of(CounterEvent.INCREMENTED);
 *       case DECREMENT -> List.of(CounterEvent.DECREMENTED);
 *     };
 *   }
 *
 *   public Integer applyEvent(Integer state, CounterEvent event) {
 *     return event == CounterEvent.INCREMENTED ? state + 1 : state - 1;
 *   }
 * }
 * }</pre>
 *
 * @param <S> the folded state type
 * @param <C> the command type
 * @param <E> the event type
 * @see AggregateManager
 */
public interface Aggregate<S, C, E> {

  /**
   * Stable name of this aggregate. Used as the key of its event log, so it must
   * never change once events have been written.
   */
  String name();

  /**
   * State of an aggregate that has no events yet.
   */
  S initialState();

  /**
   * Decides which events a command produces against the current state.
   *
   * @param state   the current folded state
   * @param command the command to decide on
   * @return the new events, possibly empty
   * @throws DomainException if the command is rejected
   */
  List<E> handleCommand(S state, C command);

  /**
   * Folds one event into the state.
   *
   * @param state the state before the event
   * @param event the event to apply
   * @return the state after the event
   */
  S applyEvent(S state, E event);
}
