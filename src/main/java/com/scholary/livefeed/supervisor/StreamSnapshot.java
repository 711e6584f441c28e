package com.scholary.livefeed.supervisor;

import java.time.Instant;

/**
 * Read-only view of a stream's runtime state at one instant.
 *
 * @param pid process id of the current transcoder, or null if none is running
 * @param startedAt when the current transcoder was launched, or null
 * @param lastError last failure reported for the stream, or null
 */
public record StreamSnapshot(
    String id,
    String name,
    String source,
    StreamStatus status,
    Long pid,
    Instant startedAt,
    int restartCount,
    String lastError,
    boolean manuallyStopped,
    String outputDirectory,
    String playlistUrl) {}
