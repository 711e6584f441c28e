package com.scholary.livefeed.metrics;

import com.scholary.livefeed.chunking.ChunkExtractor;
import com.scholary.livefeed.chunking.ChunkScheduler;
import com.scholary.livefeed.health.HealthProperties;
import com.scholary.livefeed.queue.ProcessingQueue;
import com.scholary.livefeed.queue.QueueStatus;
import com.scholary.livefeed.supervisor.ProcessSupervisor;
import com.scholary.livefeed.supervisor.StreamSnapshot;
import com.scholary.livefeed.supervisor.StreamStatus;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Builds pipeline metrics and the aggregate health verdict.
 *
 * <p>Nothing is cached: every call reads the queue, extractor, scheduler and supervisor.
 */
@Service
public class MetricsAggregator {

  private final PipelineCounters counters;
  private final ProcessingQueue queue;
  private final ChunkExtractor extractor;
  private final ChunkScheduler scheduler;
  private final ProcessSupervisor supervisor;
  private final HealthProperties healthProperties;
  private final Clock clock;

  public MetricsAggregator(
      PipelineCounters counters,
      ProcessingQueue queue,
      ChunkExtractor extractor,
      ChunkScheduler scheduler,
      ProcessSupervisor supervisor,
      HealthProperties healthProperties,
      Clock clock) {
    this.counters = counters;
    this.queue = queue;
    this.extractor = extractor;
    this.scheduler = scheduler;
    this.supervisor = supervisor;
    this.healthProperties = healthProperties;
    this.clock = clock;
  }

  public PipelineMetrics metrics() {
    return metrics(queue.status(), supervisor.list());
  }

  /**
   * Evaluate aggregate health.
   *
   * <ul>
   *   <li>UNHEALTHY: the queue is full, or streams are registered and none is active
   *   <li>DEGRADED: the queue is deep, many extractions are running, or nothing is being chunked
   *   <li>HEALTHY otherwise
   * </ul>
   */
  public PipelineHealth evaluateHealth() {
    QueueStatus queueStatus = queue.status();
    List<StreamSnapshot> streams = supervisor.list();
    PipelineMetrics metrics = metrics(queueStatus, streams);

    List<String> critical = new ArrayList<>();
    if (queueStatus.isFull()) {
      critical.add(String.format("Processing queue is full (%d)", queueStatus.maxSize()));
    }
    if (!streams.isEmpty() && metrics.activeStreams() == 0) {
      critical.add(String.format("None of %d streams is active", streams.size()));
    }

    List<String> warnings = new ArrayList<>();
    if (metrics.queueDepth() >= healthProperties.degradedQueueDepth()) {
      warnings.add(String.format("Queue depth is %d", metrics.queueDepth()));
    }
    if (metrics.activeExtractions() >= healthProperties.degradedExtractions()) {
      warnings.add(String.format("%d extractions in flight", metrics.activeExtractions()));
    }
    if (metrics.chunkedStreams() == 0) {
      warnings.add("No stream is being chunked");
    }

    List<String> issues = new ArrayList<>(critical);
    issues.addAll(warnings);
    PipelineHealth.Status status;
    if (!critical.isEmpty()) {
      status = PipelineHealth.Status.UNHEALTHY;
    } else if (!warnings.isEmpty()) {
      status = PipelineHealth.Status.DEGRADED;
    } else {
      status = PipelineHealth.Status.HEALTHY;
    }
    return new PipelineHealth(status, issues, metrics);
  }

  private PipelineMetrics metrics(QueueStatus queueStatus, List<StreamSnapshot> streams) {
    int active = 0;
    for (StreamSnapshot stream : streams) {
      if (stream.status() == StreamStatus.ACTIVE) {
        active++;
      }
    }
    return new PipelineMetrics(
        counters.chunksExtracted(),
        counters.chunksProcessed(),
        counters.chunksFailed(),
        counters.jobsFailed(),
        counters.avgExtractionMs(),
        counters.avgProcessingMs(),
        queueStatus.depth(),
        extractor.inFlightCount(),
        active,
        scheduler.scheduledCount(),
        clock.instant());
  }
}
