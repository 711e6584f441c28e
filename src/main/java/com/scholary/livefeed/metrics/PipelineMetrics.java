package com.scholary.livefeed.metrics;

import java.time.Instant;

/**
 * Point-in-time metrics of the pipeline.
 *
 * @param chunksFailed failed extractions plus chunks dropped by a full queue
 * @param jobsFailed jobs that exhausted their attempts
 * @param queueDepth waiting, delayed and processing jobs
 */
public record PipelineMetrics(
    long chunksExtracted,
    long chunksProcessed,
    long chunksFailed,
    long jobsFailed,
    double avgExtractionMs,
    double avgProcessingMs,
    int queueDepth,
    int activeExtractions,
    int activeStreams,
    int chunkedStreams,
    Instant timestamp) {}
