package io.eventlog;

/**
 * Unchecked wrapper for driver and connectivity failures. Nothing is retried.
 */
public final class StorageException extends EventLogException {

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
