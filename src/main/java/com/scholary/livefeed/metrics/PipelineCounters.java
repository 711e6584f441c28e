package com.scholary.livefeed.metrics;

import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Running counters and smoothed timings of the analysis path.
 *
 * <p>Averages are exponential moving averages with a smoothing factor of 0.1; the first sample
 * seeds the average.
 */
@Component
public class PipelineCounters {

  static final double ALPHA = 0.1;

  private final AtomicLong chunksExtracted = new AtomicLong();
  private final AtomicLong chunksFailed = new AtomicLong();
  private final AtomicLong chunksProcessed = new AtomicLong();
  private final AtomicLong jobsFailed = new AtomicLong();

  private double avgExtractionMs;
  private double avgProcessingMs;

  public void recordExtraction(long extractionMs) {
    chunksExtracted.incrementAndGet();
    synchronized (this) {
      avgExtractionMs = smooth(avgExtractionMs, extractionMs);
    }
  }

  public void recordExtractionFailure() {
    chunksFailed.incrementAndGet();
  }

  public void recordProcessed(long processingMs) {
    chunksProcessed.incrementAndGet();
    synchronized (this) {
      avgProcessingMs = smooth(avgProcessingMs, processingMs);
    }
  }

  public void recordJobFailure() {
    jobsFailed.incrementAndGet();
  }

  public long chunksExtracted() {
    return chunksExtracted.get();
  }

  public long chunksFailed() {
    return chunksFailed.get();
  }

  public long chunksProcessed() {
    return chunksProcessed.get();
  }

  public long jobsFailed() {
    return jobsFailed.get();
  }

  public synchronized double avgExtractionMs() {
    return avgExtractionMs;
  }

  public synchronized double avgProcessingMs() {
    return avgProcessingMs;
  }

  private static double smooth(double current, long sample) {
    return current == 0 ? sample : (1 - ALPHA) * current + ALPHA * sample;
  }
}
