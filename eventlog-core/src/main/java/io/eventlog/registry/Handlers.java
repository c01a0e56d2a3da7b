package io.eventlog.registry;

import io.eventlog.EventBus;
import io.eventlog.EventHandler;
import io.eventlog.TransactionalEventHandler;

import java.util.List;

/**
 * Immutable snapshot of the three handler lists of one event store.
 *
 * @param transactional transactional handlers, in registration order
 * @param eventHandlers post-commit handlers and policies, in registration order
 * @param eventBuses    event buses, in registration order
 * @param <E>           the event type
 */
public record Handlers<E>(
    List<TransactionalEventHandler<E>> transactional,
    List<EventHandler<E>> eventHandlers,
    List<EventBus<E>> eventBuses) {

  public Handlers {
    transactional = List.copyOf(transactional);
    eventHandlers = List.copyOf(eventHandlers);
    eventBuses = List.copyOf(eventBuses);
  }

  /**
   * Snapshot with no handlers at all.
   */
  public static <E> Handlers<E> empty() {
    return new Handlers<>(List.of(), List.of(), List.of());
  }

  Handlers<E> withTransactional(List<TransactionalEventHandler<E>> handlers) {
    return new Handlers<>(handlers, eventHandlers, eventBuses);
  }

  Handlers<E> withEventHandlers(List<EventHandler<E>> handlers) {
    return new Handlers<>(transactional, handlers, eventBuses);
  }

  Handlers<E> withEventBuses(List<EventBus<E>> buses) {
    return new Handlers<>(transactional, eventHandlers, buses);
  }
}
