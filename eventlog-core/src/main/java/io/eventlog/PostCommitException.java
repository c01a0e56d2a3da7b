package io.eventlog;

import java.util.List;
import java.util.Objects;

/**
 * Thrown after a successful commit when one or more post-commit handlers or
 * event buses failed.
 *
 * <p>The events are durable: {@link #committedEvents()} returns them. Every
 * failure is attached as a suppressed exception, in the order the handlers ran.
 * When thrown by an {@link AggregateManager}, {@link #aggregateState()} holds the
 * state with the committed events already folded in.
 */
public final class PostCommitException extends EventLogException {
  private final transient List<? extends StoreEvent<?>> committedEvents;
  private final transient AggregateState<?> aggregateState;

  public PostCommitException(List<? extends StoreEvent<?>> committedEvents, List<? extends Throwable> failures) {
    this(committedEvents, failures, null);
  }

  private PostCommitException(List<? extends StoreEvent<?>> committedEvents,
      List<? extends Throwable> failures, AggregateState<?> aggregateState) {
    super(failures.size() + " post-commit failure(s) after committing "
        + committedEvents.size() + " event(s)", failures.isEmpty() ? null : failures.get(0));
    this.committedEvents = List.copyOf(committedEvents);
    this.aggregateState = aggregateState;
    for (Throwable failure : failures) {
      addSuppressed(failure);
    }
  }

  /**
   * The events that were committed before the failures happened.
   */
  @SuppressWarnings("unchecked")
  public <E> List<StoreEvent<E>> committedEvents() {
    return (List<StoreEvent<E>>) committedEvents;
  }

  /**
   * Every post-commit failure, in the order they happened.
   */
  public List<Throwable> failures() {
    return List.of(getSuppressed());
  }

  /**
   * The folded state after the committed events, or {@code null} if the
   * exception came straight from an {@link EventStore}.
   */
  @SuppressWarnings("unchecked")
  public <S> AggregateState<S> aggregateState() {
    return (AggregateState<S>) aggregateState;
  }

  /**
   * Returns a copy of this exception that carries the given folded state.
   */
  public PostCommitException withAggregateState(AggregateState<?> state) {
    Objects.requireNonNull(state, "state");
    PostCommitException copy = new PostCommitException(committedEvents, failures(), state);
    copy.setStackTrace(getStackTrace());
    return copy;
  }
}
