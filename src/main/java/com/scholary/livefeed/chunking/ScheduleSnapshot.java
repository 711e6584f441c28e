package com.scholary.livefeed.chunking;

import java.time.Instant;

/**
 * State of one stream's chunk schedule.
 *
 * @param locator what extractions read, credentials removed
 * @param nextOffset offset the next tick will extract, in seconds
 * @param lastFailure the most recent chunk that ended in ERROR, or null
 */
public record ScheduleSnapshot(
    String streamId,
    String locator,
    long nextOffset,
    long chunksExtracted,
    long chunksFailed,
    Instant startedAt,
    ChunkDescriptor lastFailure) {}
