package io.eventlog.util;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.UUID;

/**
 * Generates event ids.
 *
 * <p>Ids are monotonic ULIDs carried as UUIDs: globally unique, and ordered by
 * creation time within one JVM.
 */
public final class EventIds {

  private EventIds() {
  }

  public static UUID next() {
    return UlidCreator.getMonotonicUlid().toUuid();
  }
}
