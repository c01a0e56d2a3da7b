package io.eventlog;

/**
 * Handler that runs after the write transaction committed.
 *
 * <p>The events it sees are durable. A failure is logged and reported to the
 * caller through {@link PostCommitException}, but it never removes events from
 * the log. Handlers run sequentially in registration order; one failing handler
 * does not stop the next.
 *
 * @param <E> the event type
 * @see Policy
 * @see TransactionalEventHandler
 */
@FunctionalInterface
public interface EventHandler<E> {

  /**
   * Handles one committed event.
   *
   * @param event the event
   * @throws Exception if handling failed; reported, never rolled back
   */
  void handle(StoreEvent<E> event) throws Exception;

  /**
   * Name used in logs and error messages.
   */
  default String name() {
    return getClass().getSimpleName();
  }
}
