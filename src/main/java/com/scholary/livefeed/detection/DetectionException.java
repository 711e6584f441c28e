package com.scholary.livefeed.detection;

/**
 * Exception thrown when a chunk cannot be processed by the detection pipeline.
 *
 * <p>This could be due to network issues, timeouts, a non-2xx response or an unparseable body.
 * The processing queue retries it.
 */
public class DetectionException extends RuntimeException {

  public DetectionException(String message) {
    super(message);
  }

  public DetectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
