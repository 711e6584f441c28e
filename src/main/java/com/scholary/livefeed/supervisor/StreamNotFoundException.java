package com.scholary.livefeed.supervisor;

public class StreamNotFoundException extends RuntimeException {

  public StreamNotFoundException(String message) {
    super(message);
  }

  public StreamNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
