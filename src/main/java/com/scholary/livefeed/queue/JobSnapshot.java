package com.scholary.livefeed.queue;

import com.scholary.livefeed.chunking.ChunkDescriptor;
import com.scholary.livefeed.detection.DetectionResult;
import java.time.Instant;

/** Read-only view of a processing job. */
public record JobSnapshot(
    String jobId,
    ChunkDescriptor chunk,
    JobStatus status,
    int attempts,
    int maxAttempts,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant nextAttemptAt,
    DetectionResult result,
    String error) {}
