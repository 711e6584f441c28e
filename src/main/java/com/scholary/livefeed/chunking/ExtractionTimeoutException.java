package com.scholary.livefeed.chunking;

/** Thrown when an extraction runs past its timeout. The subprocess has been killed by then. */
public class ExtractionTimeoutException extends ChunkExtractionException {

  public ExtractionTimeoutException(String message) {
    super(message);
  }

  public ExtractionTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
