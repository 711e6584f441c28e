package com.scholary.livefeed.chunking;

public class ChunkSchedulingException extends RuntimeException {

  public ChunkSchedulingException(String message) {
    super(message);
  }

  public ChunkSchedulingException(String message, Throwable cause) {
    super(message, cause);
  }
}
