package com.scholary.livefeed.supervisor;

/** Thrown when a stream is started while a runtime state for the same id already exists. */
public class StreamAlreadyExistsException extends RuntimeException {

  public StreamAlreadyExistsException(String message) {
    super(message);
  }

  public StreamAlreadyExistsException(String message, Throwable cause) {
    super(message, cause);
  }
}
