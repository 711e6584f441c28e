package com.scholary.livefeed.queue;

/**
 * Counts of jobs in the processing queue.
 *
 * @param waiting jobs eligible to run now
 * @param delayed jobs waiting out a retry backoff
 * @param processing jobs handed to a worker
 * @param completed jobs completed since startup
 * @param failed jobs failed for good since startup, evictions included
 * @param maxSize capacity for waiting, delayed and processing jobs together
 */
public record QueueStatus(
    int waiting, int delayed, int processing, long completed, long failed, int maxSize) {

  /** Jobs not yet finished: waiting, delayed and processing. */
  public int depth() {
    return waiting + delayed + processing;
  }

  public boolean isFull() {
    return depth() >= maxSize;
  }
}
