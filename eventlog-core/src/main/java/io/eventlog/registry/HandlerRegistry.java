package io.eventlog.registry;

import io.eventlog.EventBus;
import io.eventlog.EventHandler;
import io.eventlog.TransactionalEventHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Thread-safe holder of an event store's handlers.
 *
 * <p>The registry keeps one immutable {@link Handlers} snapshot. A {@code persist}
 * call takes the snapshot once and uses it to the end, so replacing handlers while
 * writes are in flight never tears a list: in-flight calls finish with the old
 * snapshot, later calls see the new one.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HandlerRegistry<OrderEvent> registry = new HandlerRegistry<OrderEvent>()
 *     .addTransactionalHandler(orderProjection)
 *     .addEventHandler(emailNotifier)
 *     .addEventBus(kafkaBus);
 *
 * // later, reconfigure without a restart
 * registry.setEventHandlers(List.of(emailNotifier, auditTrail));
 * }</pre>
 *
 * @param <E> the event type
 */
public final class HandlerRegistry<E> {
  private final AtomicReference<Handlers<E>> current;

  public HandlerRegistry() {
    this(Handlers.empty());
  }

  public HandlerRegistry(Handlers<E> initial) {
    this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
  }

  /**
   * Returns the current snapshot.
   */
  public Handlers<E> snapshot() {
    return current.get();
  }

  /**
   * Replaces every transactional handler.
   *
   * @param handlers the new list
   * @return this registry for chaining
   */
  public HandlerRegistry<E> setTransactionalHandlers(List<TransactionalEventHandler<E>> handlers) {
    List<TransactionalEventHandler<E>> copy = List.copyOf(handlers);
    current.updateAndGet(h -> h.withTransactional(copy));
    return this;
  }

  /**
   * Replaces every post-commit handler and policy.
   *
   * @param handlers the new list
   * @return this registry for chaining
   */
  public HandlerRegistry<E> setEventHandlers(List<EventHandler<E>> handlers) {
    List<EventHandler<E>> copy = List.copyOf(handlers);
    current.updateAndGet(h -> h.withEventHandlers(copy));
    return this;
  }

  /**
   * Replaces every event bus.
   *
   * @param buses the new list
   * @return this registry for chaining
   */
  public HandlerRegistry<E> setEventBuses(List<EventBus<E>> buses) {
    List<EventBus<E>> copy = List.copyOf(buses);
    current.updateAndGet(h -> h.withEventBuses(copy));
    return this;
  }

  /**
   * Appends a transactional handler.
   *
   * @param handler the handler
   * @return this registry for chaining
   */
  public HandlerRegistry<E> addTransactionalHandler(TransactionalEventHandler<E> handler) {
    Objects.requireNonNull(handler, "handler");
    current.updateAndGet(h -> h.withTransactional(append(h.transactional(), handler)));
    return this;
  }

  /**
   * Appends a post-commit handler or policy.
   *
   * @param handler the handler
   * @return this registry for chaining
   */
  public HandlerRegistry<E> addEventHandler(EventHandler<E> handler) {
    Objects.requireNonNull(handler, "handler");
    current.updateAndGet(h -> h.withEventHandlers(append(h.eventHandlers(), handler)));
    return this;
  }

  /**
   * Appends an event bus.
   *
   * @param bus the bus
   * @return this registry for chaining
   */
  public HandlerRegistry<E> addEventBus(EventBus<E> bus) {
    Objects.requireNonNull(bus, "bus");
    current.updateAndGet(h -> h.withEventBuses(append(h.eventBuses(), bus)));
    return this;
  }

  private static <T> List<T> append(List<T> list, T item) {
    List<T> copy = new ArrayList<>(list.size() + 1);
    copy.addAll(list);
    copy.add(item);
    return copy;
  }
}
