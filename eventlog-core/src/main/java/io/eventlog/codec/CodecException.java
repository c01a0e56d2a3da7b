package io.eventlog.codec;

import io.eventlog.EventLogException;

/**
 * Thrown when a payload cannot be encoded or decoded.
 */
public final class CodecException extends EventLogException {

  public CodecException(String message, Throwable cause) {
    super(message, cause);
  }
}
