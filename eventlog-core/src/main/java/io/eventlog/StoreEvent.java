package io.eventlog;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A persisted event: the payload plus the metadata the store assigned on write.
 *
 * <p>{@code (aggregateId, sequenceNumber)} is unique per aggregate log and is the
 * optimistic-concurrency key. {@code id} is globally unique and addresses the row
 * for administrative lookups.
 *
 * @param id             globally unique event id
 * @param aggregateId    id of the owning aggregate
 * @param payload        the domain event
 * @param occurredAt     time the event was written
 * @param sequenceNumber position in the aggregate's log, starting at 1
 * @param <E>            the event type
 */
public record StoreEvent<E>(
    UUID id,
    UUID aggregateId,
    E payload,
    Instant occurredAt,
    long sequenceNumber) {

  public StoreEvent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(aggregateId, "aggregateId");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(occurredAt, "occurredAt");
    if (sequenceNumber < 1) {
      throw new IllegalArgumentException("sequenceNumber must be >= 1");
    }
  }

  /**
   * Returns a copy carrying a different payload. Used by administrative updates.
   */
  public StoreEvent<E> withPayload(E newPayload) {
    return new StoreEvent<>(id, aggregateId, newPayload, occurredAt, sequenceNumber);
  }
}
