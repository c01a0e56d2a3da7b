package io.eventlog;

import java.util.Objects;
import java.util.UUID;

/**
 * Immutable snapshot of an aggregate: its identity, the sequence number of the
 * last folded event and the folded state itself.
 *
 * <p>A fresh state has {@code sequenceNumber == 0}. The {@link AggregateManager}
 * is the only component that advances it.
 *
 * @param <S> the folded state type
 */
public final class AggregateState<S> {
  private final UUID id;
  private final long sequenceNumber;
  private final S inner;

  private AggregateState(UUID id, long sequenceNumber, S inner) {
    this.id = Objects.requireNonNull(id, "id");
    if (sequenceNumber < 0) {
      throw new IllegalArgumentException("sequenceNumber must be >= 0");
    }
    this.sequenceNumber = sequenceNumber;
    this.inner = inner;
  }

  /**
   * Creates a fresh state with a random id.
   *
   * @param initial the aggregate's initial state
   * @return a state at sequence number 0
   */
  public static <S> AggregateState<S> create(S initial) {
    return new AggregateState<>(UUID.randomUUID(), 0, initial);
  }

  /**
   * Creates a fresh state for the given id.
   *
   * @param id      the aggregate id
   * @param initial the aggregate's initial state
   * @return a state at sequence number 0
   */
  public static <S> AggregateState<S> withId(UUID id, S initial) {
    return new AggregateState<>(id, 0, initial);
  }

  public UUID id() {
    return id;
  }

  public long sequenceNumber() {
    return sequenceNumber;
  }

  public S inner() {
    return inner;
  }

  /**
   * Sequence number the next persisted event will receive.
   */
  public long nextSequenceNumber() {
    return sequenceNumber + 1;
  }

  /**
   * Returns the state after folding an event with the given sequence number.
   */
  AggregateState<S> applied(S newInner, long newSequenceNumber) {
    return new AggregateState<>(id, newSequenceNumber, newInner);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof AggregateState<?> other)) return false;
    return sequenceNumber == other.sequenceNumber
        && id.equals(other.id)
        && Objects.equals(inner, other.inner);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, sequenceNumber, inner);
  }

  @Override
  public String toString() {
    return "AggregateState{id=" + id + ", sequenceNumber=" + sequenceNumber + ", inner=" + inner + "}";
  }
}
