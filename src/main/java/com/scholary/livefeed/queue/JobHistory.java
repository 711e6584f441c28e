package com.scholary.livefeed.queue;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Repository;

/**
 * Bounded in-memory history of finished processing jobs.
 *
 * <p>Uses Caffeine caches for automatic eviction, one for completed jobs and one for failures,
 * so a burst of successes never pushes the failures an operator wants to look at out of memory.
 * Failed jobs here are the dead letter: nothing retries them.
 */
@Repository
public class JobHistory {

  private final Cache<String, JobSnapshot> completed;
  private final Cache<String, JobSnapshot> failed;

  public JobHistory(QueueProperties properties) {
    this.completed =
        Caffeine.newBuilder()
            .maximumSize(properties.historySize())
            .expireAfterWrite(properties.historyTtl())
            .build();
    this.failed =
        Caffeine.newBuilder()
            .maximumSize(properties.historySize())
            .expireAfterWrite(properties.historyTtl())
            .build();
  }

  public void recordCompleted(JobSnapshot job) {
    completed.put(job.jobId(), job);
  }

  public void recordFailed(JobSnapshot job) {
    failed.put(job.jobId(), job);
  }

  public Optional<JobSnapshot> find(String jobId) {
    JobSnapshot job = completed.getIfPresent(jobId);
    if (job == null) {
      job = failed.getIfPresent(jobId);
    }
    return Optional.ofNullable(job);
  }

  /** Completed jobs, most recently finished first. */
  public List<JobSnapshot> completed() {
    return newestFirst(completed);
  }

  /** Failed jobs, most recently finished first. */
  public List<JobSnapshot> failed() {
    return newestFirst(failed);
  }

  private static List<JobSnapshot> newestFirst(Cache<String, JobSnapshot> cache) {
    List<JobSnapshot> jobs = new ArrayList<>(cache.asMap().values());
    jobs.sort(Comparator.comparing(JobSnapshot::completedAt).reversed());
    return jobs;
  }
}
