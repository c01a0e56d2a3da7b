package io.eventlog;

import java.util.List;

/**
 * Publishes committed events to subscribers outside the process.
 *
 * <p>Called once per {@code persist} with the whole committed batch, after the
 * post-commit handlers. The transport is up to the implementation. Failures are
 * reported through {@link PostCommitException} and do not affect the log.
 *
 * @param <E> the event type
 */
@FunctionalInterface
public interface EventBus<E> {

  /**
   * Publishes a batch of committed events.
   *
   * @param events the events of one {@code persist} call, in sequence order
   * @throws Exception if publishing failed
   */
  void publish(List<StoreEvent<E>> events) throws Exception;

  /**
   * Name used in logs and error messages.
   */
  default String name() {
    return getClass().getSimpleName();
  }
}
