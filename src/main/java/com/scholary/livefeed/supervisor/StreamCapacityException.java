package com.scholary.livefeed.supervisor;

/** Thrown when starting a stream would exceed the configured maximum of concurrent streams. */
public class StreamCapacityException extends RuntimeException {

  public StreamCapacityException(String message) {
    super(message);
  }

  public StreamCapacityException(String message, Throwable cause) {
    super(message, cause);
  }
}
