package io.eventlog;

import java.util.UUID;

/**
 * Thrown when another writer already persisted an event with the same
 * {@code (aggregateId, sequenceNumber)}.
 *
 * <p>The batch was rolled back. The caller must reload the aggregate and decide
 * the command again; stores never retry on their own.
 */
public final class ConflictException extends EventLogException {
  private final UUID aggregateId;
  private final long sequenceNumber;

  public ConflictException(UUID aggregateId, long sequenceNumber, Throwable cause) {
    super("Sequence number " + sequenceNumber + " of aggregate " + aggregateId
        + " was already written by another writer", cause);
    this.aggregateId = aggregateId;
    this.sequenceNumber = sequenceNumber;
  }

  public UUID aggregateId() {
    return aggregateId;
  }

  /**
   * The sequence number whose insert collided.
   */
  public long sequenceNumber() {
    return sequenceNumber;
  }
}
