package com.scholary.livefeed.queue;

import com.scholary.livefeed.chunking.ChunkDescriptor;
import com.scholary.livefeed.detection.DetectionResult;
import java.time.Instant;

/**
 * A chunk on its way through the detection pipeline.
 *
 * <p>Mutated only by {@link ProcessingQueue} under its lock. Priority is the chunk's extraction
 * time (older first); the admission sequence breaks ties.
 */
class ProcessingJob {

  private final String jobId;
  private final ChunkDescriptor chunk;
  private final long sequence;
  private final Instant createdAt;

  private JobStatus status = JobStatus.WAITING;
  private int attempts;
  private Instant startedAt;
  private Instant completedAt;
  private Instant nextAttemptAt;
  private DetectionResult result;
  private String error;

  ProcessingJob(String jobId, ChunkDescriptor chunk, long sequence, Instant createdAt) {
    this.jobId = jobId;
    this.chunk = chunk;
    this.sequence = sequence;
    this.createdAt = createdAt;
    this.nextAttemptAt = createdAt;
  }

  String getJobId() {
    return jobId;
  }

  ChunkDescriptor getChunk() {
    return chunk;
  }

  Instant getPriority() {
    return chunk.extractedAt();
  }

  long getSequence() {
    return sequence;
  }

  JobStatus getStatus() {
    return status;
  }

  int getAttempts() {
    return attempts;
  }

  Instant getNextAttemptAt() {
    return nextAttemptAt;
  }

  Instant getCreatedAt() {
    return createdAt;
  }

  boolean isEligible(Instant now) {
    return !nextAttemptAt.isAfter(now);
  }

  void markProcessing(Instant now) {
    status = JobStatus.PROCESSING;
    attempts++;
    startedAt = now;
  }

  void markCompleted(DetectionResult result, Instant now) {
    status = JobStatus.COMPLETED;
    this.result = result;
    this.error = null;
    completedAt = now;
  }

  void markRetry(String error, Instant nextAttemptAt) {
    status = JobStatus.WAITING;
    this.error = error;
    this.nextAttemptAt = nextAttemptAt;
  }

  void markFailed(String error, Instant now) {
    status = JobStatus.FAILED;
    this.error = error;
    completedAt = now;
  }

  JobSnapshot snapshot(int maxAttempts) {
    return new JobSnapshot(
        jobId,
        chunk,
        status,
        attempts,
        maxAttempts,
        createdAt,
        startedAt,
        completedAt,
        status == JobStatus.WAITING ? nextAttemptAt : null,
        result,
        error);
  }
}
