package com.scholary.livefeed.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log pipeline events with structured fields that can be queried in
 * Kibana. Event fields live in the MDC only for the duration of the log call.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log transcoder launch event. */
  public void logStreamLaunched(String streamId, long pid, String source, int restartCount) {
    try {
      MDC.put("event_type", "stream_launched");
      MDC.put("streamId", streamId);
      MDC.put("pid", String.valueOf(pid));
      MDC.put("restartCount", String.valueOf(restartCount));

      logger.info(
          "Transcoder launched: stream={}, pid={}, source={}, restarts={}",
          streamId,
          pid,
          source,
          restartCount);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcoder failure event (crash or spawn failure). */
  public void logStreamFailed(String streamId, String error, int restartCount, String outputTail) {
    try {
      MDC.put("event_type", "stream_failed");
      MDC.put("streamId", streamId);
      MDC.put("restartCount", String.valueOf(restartCount));
      MDC.put("errorType", "transcoder");

      logger.error(
          "Transcoder failed: stream={}, error={}, restarts={}, output={}",
          streamId,
          error,
          restartCount,
          outputTail);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcoder restart event. */
  public void logStreamRestart(String streamId, String cause, int restartCount, int maxRestarts) {
    try {
      MDC.put("event_type", "stream_restart");
      MDC.put("streamId", streamId);
      MDC.put("cause", cause);
      MDC.put("restartCount", String.valueOf(restartCount));
      MDC.put("maxRestarts", String.valueOf(maxRestarts));

      logger.warn(
          "Restarting stream: stream={}, cause={}, restarts={}/{}",
          streamId,
          cause,
          restartCount,
          maxRestarts);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk extracted event. */
  public void logChunkExtracted(
      String streamId, String chunkId, long offsetSeconds, long sizeBytes, long extractionMs) {
    try {
      MDC.put("event_type", "chunk_extracted");
      MDC.put("streamId", streamId);
      MDC.put("chunkId", chunkId);
      MDC.put("offset", String.valueOf(offsetSeconds));
      MDC.put("sizeBytes", String.valueOf(sizeBytes));
      MDC.put("extractionMs", String.valueOf(extractionMs));

      logger.info(
          "Chunk extracted: stream={}, chunk={}, offset={}s, size={} bytes, took={}ms",
          streamId,
          chunkId,
          offsetSeconds,
          sizeBytes,
          extractionMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk extraction failure event. */
  public void logChunkFailed(
      String streamId, long offsetSeconds, String errorType, String message) {
    try {
      MDC.put("event_type", "chunk_failed");
      MDC.put("streamId", streamId);
      MDC.put("offset", String.valueOf(offsetSeconds));
      MDC.put("errorType", errorType);

      logger.error(
          "Chunk extraction failed: stream={}, offset={}s, error={}, message={}",
          streamId,
          offsetSeconds,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log processing retry event. */
  public void logJobRetry(
      String jobId, String chunkId, int attempt, int maxAttempts, long delayMs, String message) {
    try {
      MDC.put("event_type", "job_retry");
      MDC.put("jobId", jobId);
      MDC.put("chunkId", chunkId);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));

      logger.warn(
          "Processing retry: job={}, chunk={}, attempt={}/{}, retryIn={}ms, message={}",
          jobId,
          chunkId,
          attempt,
          maxAttempts,
          delayMs,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log terminal processing failure event. */
  public void logJobFailed(String jobId, String chunkId, int attempts, String message) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("jobId", jobId);
      MDC.put("chunkId", chunkId);
      MDC.put("attempt", String.valueOf(attempts));

      logger.error(
          "Processing failed: job={}, chunk={}, attempts={}, message={}",
          jobId,
          chunkId,
          attempts,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log processing completed event. */
  public void logJobCompleted(String jobId, String chunkId, long processingMs, int detections) {
    try {
      MDC.put("event_type", "job_completed");
      MDC.put("jobId", jobId);
      MDC.put("chunkId", chunkId);
      MDC.put("processingMs", String.valueOf(processingMs));

      logger.info(
          "Processing completed: job={}, chunk={}, took={}ms, detections={}",
          jobId,
          chunkId,
          processingMs,
          detections);
    } finally {
      clearEventFields();
    }
  }

  /** Set stream context in MDC. */
  public static void setStreamContext(String streamId) {
    MDC.put("streamId", streamId);
  }

  /** Clear stream context from MDC. */
  public static void clearStreamContext() {
    MDC.remove("streamId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("pid");
    MDC.remove("restartCount");
    MDC.remove("maxRestarts");
    MDC.remove("cause");
    MDC.remove("chunkId");
    MDC.remove("jobId");
    MDC.remove("offset");
    MDC.remove("sizeBytes");
    MDC.remove("extractionMs");
    MDC.remove("processingMs");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("errorType");
  }
}
