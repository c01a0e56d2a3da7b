package io.eventlog;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class StoreEventTest {

  @Test
  void sequenceNumberStartsAtOne() {
    assertThrows(IllegalArgumentException.class,
        () -> new StoreEvent<>(UUID.randomUUID(), UUID.randomUUID(), "x", Instant.now(), 0));
  }

  @Test
  void requiredFieldsThrowOnNull() {
    UUID id = UUID.randomUUID();
    Instant now = Instant.now();
    assertThrows(NullPointerException.class, () -> new StoreEvent<>(null, id, "x", now, 1));
    assertThrows(NullPointerException.class, () -> new StoreEvent<>(id, null, "x", now, 1));
    assertThrows(NullPointerException.class, () -> new StoreEvent<String>(id, id, null, now, 1));
    assertThrows(NullPointerException.class, () -> new StoreEvent<>(id, id, "x", null, 1));
  }

  @Test
  void withPayloadKeepsEnvelope() {
    StoreEvent<String> event = new StoreEvent<>(UUID.randomUUID(), UUID.randomUUID(), "old", Instant.now(), 4);

    StoreEvent<String> updated = event.withPayload("new");

    assertEquals("new", updated.payload());
    assertEquals(event.id(), updated.id());
    assertEquals(event.aggregateId(), updated.aggregateId());
    assertEquals(event.occurredAt(), updated.occurredAt());
    assertEquals(4, updated.sequenceNumber());
  }
}
