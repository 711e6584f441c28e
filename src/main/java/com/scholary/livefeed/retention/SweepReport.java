package com.scholary.livefeed.retention;

import java.time.Instant;

/** Outcome of one retention sweep. */
public record SweepReport(
    int chunksDeleted, int processedDeleted, int segmentsDeleted, long bytesFreed, Instant at) {

  public int filesDeleted() {
    return chunksDeleted + processedDeleted + segmentsDeleted;
  }
}
