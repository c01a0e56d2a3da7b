package io.eventlog;

import java.util.Optional;
import java.util.UUID;

/**
 * Point operations on single event rows, addressed by event id.
 *
 * <p>Meant for operational correction (fixing a malformed payload, removing a
 * single row). None of these run handlers or buses, and none are part of the
 * command path.
 *
 * @param <E> the event type
 */
public interface EventAdmin<E> {

  /**
   * Looks up one event by its id.
   *
   * @param eventId the event id
   * @return the event, or empty if no row has this id
   */
  Optional<StoreEvent<E>> findById(UUID eventId);

  /**
   * Replaces the payload of one event.
   *
   * @param eventId the event id
   * @param payload the new payload
   * @return {@code true} if a row was updated
   */
  boolean updatePayload(UUID eventId, E payload);

  /**
   * Deletes one event.
   *
   * @param eventId the event id
   * @return {@code true} if a row was deleted
   */
  boolean deleteById(UUID eventId);
}
