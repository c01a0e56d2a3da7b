package io.eventlog;

import java.util.List;
import java.util.UUID;

/**
 * Owns the read and write protocol of one aggregate's event log.
 *
 * <p>{@link #persist} is atomic: either every new event and every transactional
 * handler effect commits, or nothing does. Post-commit handlers and event buses
 * run only after the commit and can never undo it.
 *
 * @param <E> the event type
 * @see io.eventlog.jdbc.JdbcEventStore
 */
public interface EventStore<E> {

  /**
   * Returns all events of an aggregate in ascending sequence order.
   *
   * @param aggregateId the aggregate id
   * @return the events, empty if the aggregate has no history
   * @throws StorageException            if the events cannot be read
   * @throws io.eventlog.codec.CodecException if a payload cannot be decoded
   */
  List<StoreEvent<E>> byAggregateId(UUID aggregateId);

  /**
   * Persists new events after the last event folded into {@code state}.
   *
   * <p>The first event gets {@code state.sequenceNumber() + 1}, the next one
   * {@code + 2}, and so on. The caller folds the returned events into its state.
   *
   * @param state     the state the events were decided against
   * @param newEvents the events to persist, in order
   * @return the persisted events
   * @throws ConflictException         if another writer already used one of the sequence numbers
   * @throws HandlerRejectedException  if a transactional handler failed; nothing was written
   * @throws StorageException          if the write failed; nothing was written
   * @throws PostCommitException       if the write committed but post-commit handlers or buses failed
   */
  List<StoreEvent<E>> persist(AggregateState<?> state, List<E> newEvents);

  /**
   * Deletes every event of an aggregate.
   *
   * @param aggregateId the aggregate id
   * @throws StorageException if the delete failed
   */
  void delete(UUID aggregateId);
}
