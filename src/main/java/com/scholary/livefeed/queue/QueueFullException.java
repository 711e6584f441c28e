package com.scholary.livefeed.queue;

/**
 * Exception thrown when a chunk is offered to a full processing queue and no waiting job has a
 * lower priority than it.
 */
public class QueueFullException extends RuntimeException {

  public QueueFullException(String message) {
    super(message);
  }

  public QueueFullException(String message, Throwable cause) {
    super(message, cause);
  }
}
