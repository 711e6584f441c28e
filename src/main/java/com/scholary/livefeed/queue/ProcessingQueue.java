package com.scholary.livefeed.queue;

import com.scholary.livefeed.chunking.ChunkDescriptor;
import com.scholary.livefeed.chunking.ChunkStatus;
import com.scholary.livefeed.detection.DetectionResult;
import com.scholary.livefeed.detection.DetectionService;
import com.scholary.livefeed.logging.StructuredLogger;
import com.scholary.livefeed.metrics.PipelineCounters;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Priority queue of chunks waiting for the detection pipeline.
 *
 * <p>How it works:
 *
 * <ol>
 *   <li>{@link #enqueue} admits a READY chunk as a WAITING job. Older chunks go first.
 *   <li>When the queue is full, a new chunk evicts the newest waiting chunk, but only if that
 *       one is strictly newer than the new chunk. Otherwise the new chunk is rejected. Jobs being
 *       processed count towards {@code max-size}.
 *   <li>{@link #processNext} takes the highest-priority job whose backoff has elapsed and hands
 *       it to the {@link DetectionService}, outside the lock.
 *   <li>A failure is retried after {@code backoff × 2^(attempts-1)} until {@code max-attempts}
 *       attempts have been made; then the job is FAILED and moves to the dead letter.
 * </ol>
 *
 * <p>All job state is guarded by a single lock. Observers get snapshots and never wait for a
 * detection call.
 */
@Service
public class ProcessingQueue {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessingQueue.class);

  private static final Comparator<ProcessingJob> PRIORITY =
      Comparator.comparing(ProcessingJob::getPriority)
          .thenComparingLong(ProcessingJob::getSequence);

  private final DetectionService detectionService;
  private final JobHistory history;
  private final QueueProperties properties;
  private final PipelineCounters counters;
  private final Clock clock;
  private final StructuredLogger structuredLogger;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition workAvailable = lock.newCondition();
  private final TreeSet<ProcessingJob> waiting = new TreeSet<>(PRIORITY);
  private final Map<String, ProcessingJob> unfinished = new HashMap<>();
  private long sequence;
  private int processing;
  private long completedTotal;
  private long failedTotal;

  public ProcessingQueue(
      DetectionService detectionService,
      JobHistory history,
      QueueProperties properties,
      PipelineCounters counters,
      Clock clock) {
    this.detectionService = detectionService;
    this.history = history;
    this.properties = properties;
    this.counters = counters;
    this.clock = clock;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  /**
   * Admit a chunk for processing.
   *
   * @param chunk a READY chunk
   * @return the job id
   * @throws QueueFullException if the queue is full and nothing can be evicted
   * @throws IllegalArgumentException if the chunk is not READY
   */
  public String enqueue(ChunkDescriptor chunk) {
    if (chunk.status() != ChunkStatus.READY || chunk.extractedAt() == null) {
      throw new IllegalArgumentException(
          "Only extracted chunks can be queued, got " + chunk.status() + " for " + chunk.id());
    }

    lock.lock();
    try {
      Instant now = clock.instant();
      // jobs in flight hold their slot so a retry always fits back in
      if (waiting.size() + processing >= properties.maxSize()) {
        ProcessingJob lowest = waiting.isEmpty() ? null : waiting.last();
        if (lowest == null || !lowest.getPriority().isAfter(chunk.extractedAt())) {
          throw new QueueFullException(
              String.format(
                  "Processing queue is full (%d waiting, %d processing), rejected chunk %s",
                  waiting.size(), processing, chunk.id()));
        }
        evict(lowest, now);
      }

      ProcessingJob job = new ProcessingJob(UUID.randomUUID().toString(), chunk, sequence++, now);
      waiting.add(job);
      unfinished.put(job.getJobId(), job);
      workAvailable.signal();

      LOGGER.debug(
          "Queued chunk {} of stream {} as job {} ({} waiting)",
          chunk.id(),
          chunk.streamId(),
          job.getJobId(),
          waiting.size());
      return job.getJobId();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Process the highest-priority eligible job, if there is one.
   *
   * <p>Blocks for the duration of the detection call. Worker threads call this in a loop.
   *
   * @return true if a job was processed (successfully or not)
   */
  public boolean processNext() {
    ProcessingJob job;
    lock.lock();
    try {
      job = takeEligible(clock.instant());
      if (job == null) {
        return false;
      }
      job.markProcessing(clock.instant());
      processing++;
    } finally {
      lock.unlock();
    }

    MDC.put("jobId", job.getJobId());
    MDC.put("streamId", job.getChunk().streamId());
    try {
      long startMillis = clock.millis();
      DetectionResult result = null;
      RuntimeException failure = null;
      try {
        result = detectionService.process(job.getChunk());
      } catch (RuntimeException e) {
        failure = e;
      }
      long elapsedMillis = clock.millis() - startMillis;

      if (failure == null) {
        complete(job, result, elapsedMillis);
      } else {
        fail(job, failure);
      }
      return true;
    } finally {
      MDC.remove("jobId");
      MDC.remove("streamId");
    }
  }

  /**
   * Wait until a job may be eligible, or at most {@code maxWait}.
   *
   * <p>Returns early when a job is enqueued or when the earliest backoff runs out.
   */
  public void awaitWork(Duration maxWait) throws InterruptedException {
    lock.lock();
    try {
      Instant now = clock.instant();
      Duration wait = maxWait;
      for (ProcessingJob job : waiting) {
        if (job.isEligible(now)) {
          return;
        }
        Duration untilEligible = Duration.between(now, job.getNextAttemptAt());
        if (untilEligible.compareTo(wait) < 0) {
          wait = untilEligible;
        }
      }
      workAvailable.await(Math.max(1, wait.toMillis()), TimeUnit.MILLISECONDS);
    } finally {
      lock.unlock();
    }
  }

  /** Wake every worker blocked in {@link #awaitWork}. */
  public void wakeAll() {
    lock.lock();
    try {
      workAvailable.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public QueueStatus status() {
    lock.lock();
    try {
      Instant now = clock.instant();
      int eligible = 0;
      for (ProcessingJob job : waiting) {
        if (job.isEligible(now)) {
          eligible++;
        }
      }
      return new QueueStatus(
          eligible,
          waiting.size() - eligible,
          processing,
          completedTotal,
          failedTotal,
          properties.maxSize());
    } finally {
      lock.unlock();
    }
  }

  public Optional<JobSnapshot> job(String jobId) {
    lock.lock();
    try {
      ProcessingJob job = unfinished.get(jobId);
      if (job != null) {
        return Optional.of(job.snapshot(properties.maxAttempts()));
      }
    } finally {
      lock.unlock();
    }
    return history.find(jobId);
  }

  /**
   * Most recent jobs across all states, newest first.
   *
   * @param limit maximum number of jobs to return
   */
  public List<JobSnapshot> recentJobs(int limit) {
    List<JobSnapshot> jobs = new ArrayList<>();
    lock.lock();
    try {
      for (ProcessingJob job : unfinished.values()) {
        jobs.add(job.snapshot(properties.maxAttempts()));
      }
    } finally {
      lock.unlock();
    }
    jobs.addAll(history.completed());
    jobs.addAll(history.failed());
    return jobs.stream()
        .sorted(Comparator.comparing(JobSnapshot::createdAt).reversed())
        .limit(limit)
        .collect(Collectors.toList());
  }

  /** Jobs that failed for good, most recent first. */
  public List<JobSnapshot> recentFailures() {
    return history.failed();
  }

  private ProcessingJob takeEligible(Instant now) {
    for (ProcessingJob job : waiting) {
      if (job.isEligible(now)) {
        waiting.remove(job);
        return job;
      }
    }
    return null;
  }

  private void complete(ProcessingJob job, DetectionResult result, long elapsedMillis) {
    JobSnapshot snapshot;
    lock.lock();
    try {
      job.markCompleted(result, clock.instant());
      processing--;
      completedTotal++;
      unfinished.remove(job.getJobId());
      snapshot = job.snapshot(properties.maxAttempts());
    } finally {
      lock.unlock();
    }
    history.recordCompleted(snapshot);
    counters.recordProcessed(elapsedMillis);
    structuredLogger.logJobCompleted(
        job.getJobId(),
        job.getChunk().id(),
        elapsedMillis,
        result == null ? 0 : result.detectionCount());
  }

  private void fail(ProcessingJob job, RuntimeException failure) {
    String message = failure.getMessage() == null ? failure.toString() : failure.getMessage();
    JobSnapshot deadLetter = null;
    long delayMillis = 0;
    lock.lock();
    try {
      Instant now = clock.instant();
      processing--;
      if (job.getAttempts() < properties.maxAttempts()) {
        Duration delay = backoff(job.getAttempts());
        delayMillis = delay.toMillis();
        job.markRetry(message, now.plus(delay));
        waiting.add(job);
        workAvailable.signal();
      } else {
        job.markFailed(message, now);
        failedTotal++;
        unfinished.remove(job.getJobId());
        deadLetter = job.snapshot(properties.maxAttempts());
      }
    } finally {
      lock.unlock();
    }

    if (deadLetter == null) {
      structuredLogger.logJobRetry(
          job.getJobId(),
          job.getChunk().id(),
          job.getAttempts(),
          properties.maxAttempts(),
          delayMillis,
          message);
    } else {
      history.recordFailed(deadLetter);
      counters.recordJobFailure();
      structuredLogger.logJobFailed(
          job.getJobId(), job.getChunk().id(), job.getAttempts(), message);
    }
  }

  /** Caller holds the lock. */
  private void evict(ProcessingJob job, Instant now) {
    waiting.remove(job);
    unfinished.remove(job.getJobId());
    job.markFailed("Evicted from full queue by an older chunk", now);
    failedTotal++;
    history.recordFailed(job.snapshot(properties.maxAttempts()));
    LOGGER.warn(
        "Queue full, evicted job {} (chunk {} of stream {})",
        job.getJobId(),
        job.getChunk().id(),
        job.getChunk().streamId());
  }

  /** Delay before the next attempt, after {@code attempts} failed attempts. */
  Duration backoff(int attempts) {
    return properties.backoff().multipliedBy(1L << Math.max(0, attempts - 1));
  }
}
