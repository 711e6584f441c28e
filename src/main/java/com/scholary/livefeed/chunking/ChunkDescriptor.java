package com.scholary.livefeed.chunking;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One chunk cut out of a live stream.
 *
 * @param startOffset offset into the stream, in seconds
 * @param duration nominal duration in seconds; the file may be shorter at the live edge
 * @param sizeBytes file size once READY, otherwise null
 * @param extractedAt when the extraction finished (or failed); orders jobs in the queue
 * @param error failure text when status is ERROR, otherwise null
 */
public record ChunkDescriptor(
    String id,
    String streamId,
    long startOffset,
    int duration,
    Path path,
    ChunkStatus status,
    Long sizeBytes,
    Instant extractedAt,
    String error) {

  static ChunkDescriptor extracting(
      String id, String streamId, long startOffset, int duration, Path path) {
    return new ChunkDescriptor(
        id, streamId, startOffset, duration, path, ChunkStatus.EXTRACTING, null, null, null);
  }

  public ChunkDescriptor ready(long size, Instant at) {
    return new ChunkDescriptor(
        id, streamId, startOffset, duration, path, ChunkStatus.READY, size, at, null);
  }

  public ChunkDescriptor failed(String reason, Instant at) {
    return new ChunkDescriptor(
        id, streamId, startOffset, duration, path, ChunkStatus.ERROR, null, at, reason);
  }
}
