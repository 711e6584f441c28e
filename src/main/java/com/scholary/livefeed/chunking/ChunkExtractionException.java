package com.scholary.livefeed.chunking;

import java.util.Optional;

/**
 * Exception thrown when a chunk cannot be extracted.
 *
 * <p>Covers ffmpeg failing to start, exiting with an error, or producing no output.
 */
public class ChunkExtractionException extends RuntimeException {

  private transient ChunkDescriptor chunk;

  public ChunkExtractionException(String message) {
    super(message);
  }

  public ChunkExtractionException(String message, Throwable cause) {
    super(message, cause);
  }

  /** The chunk that failed, in ERROR, once the extractor has attached it. */
  public Optional<ChunkDescriptor> chunk() {
    return Optional.ofNullable(chunk);
  }

  void setChunk(ChunkDescriptor chunk) {
    this.chunk = chunk;
  }
}
