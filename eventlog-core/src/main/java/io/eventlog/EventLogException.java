package io.eventlog;

/**
 * Root of the unchecked exceptions thrown by event stores and aggregate managers.
 */
public class EventLogException extends RuntimeException {

  public EventLogException(String message) {
    super(message);
  }

  public EventLogException(String message, Throwable cause) {
    super(message, cause);
  }
}
