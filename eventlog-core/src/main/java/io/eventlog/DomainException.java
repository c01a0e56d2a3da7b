package io.eventlog;

/**
 * Thrown by {@link Aggregate#handleCommand} when a command is rejected by the
 * aggregate's own rules. Nothing is persisted.
 *
 * <p>Aggregates may subclass it to carry domain-specific detail.
 */
public class DomainException extends EventLogException {

  public DomainException(String message) {
    super(message);
  }

  public DomainException(String message, Throwable cause) {
    super(message, cause);
  }
}
