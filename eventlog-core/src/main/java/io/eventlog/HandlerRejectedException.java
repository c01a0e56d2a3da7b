package io.eventlog;

/**
 * Thrown when a {@link TransactionalEventHandler} failed. The whole batch was
 * rolled back.
 */
public final class HandlerRejectedException extends EventLogException {
  private final String handlerName;
  private final transient StoreEvent<?> event;

  public HandlerRejectedException(String handlerName, StoreEvent<?> event, Throwable cause) {
    super("Transactional handler " + handlerName + " rejected event " + event.id()
        + " (aggregate " + event.aggregateId() + ", sequence " + event.sequenceNumber() + ")", cause);
    this.handlerName = handlerName;
    this.event = event;
  }

  public String handlerName() {
    return handlerName;
  }

  /**
   * The event the handler was processing. It was never committed.
   */
  public StoreEvent<?> event() {
    return event;
  }
}
