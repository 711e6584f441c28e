package com.scholary.livefeed.api;

import com.scholary.livefeed.chunking.ChunkScheduler;
import com.scholary.livefeed.chunking.ChunkingProperties;
import com.scholary.livefeed.health.HealthMonitor;
import com.scholary.livefeed.metrics.MetricsAggregator;
import com.scholary.livefeed.metrics.PipelineHealth;
import com.scholary.livefeed.monitoring.KibanaUrlGenerator;
import com.scholary.livefeed.queue.ProcessingQueue;
import com.scholary.livefeed.queue.QueueProperties;
import com.scholary.livefeed.supervisor.ProcessSupervisor;
import com.scholary.livefeed.supervisor.SupervisorProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Aggregate pipeline health.
 *
 * <p>{@code /api/health} answers 503 only when the pipeline is UNHEALTHY; a DEGRADED pipeline
 * still serves and answers 200.
 */
@RestController
@RequestMapping("/api/health")
@Tag(name = "Health", description = "Pipeline health and metrics")
public class HealthController {

  private final MetricsAggregator metricsAggregator;
  private final ProcessingQueue queue;
  private final ProcessSupervisor supervisor;
  private final ChunkScheduler chunkScheduler;
  private final HealthMonitor healthMonitor;
  private final KibanaUrlGenerator kibanaUrlGenerator;
  private final ChunkingProperties chunkingProperties;
  private final QueueProperties queueProperties;
  private final SupervisorProperties supervisorProperties;

  public HealthController(
      MetricsAggregator metricsAggregator,
      ProcessingQueue queue,
      ProcessSupervisor supervisor,
      ChunkScheduler chunkScheduler,
      HealthMonitor healthMonitor,
      KibanaUrlGenerator kibanaUrlGenerator,
      ChunkingProperties chunkingProperties,
      QueueProperties queueProperties,
      SupervisorProperties supervisorProperties) {
    this.metricsAggregator = metricsAggregator;
    this.queue = queue;
    this.supervisor = supervisor;
    this.chunkScheduler = chunkScheduler;
    this.healthMonitor = healthMonitor;
    this.kibanaUrlGenerator = kibanaUrlGenerator;
    this.chunkingProperties = chunkingProperties;
    this.queueProperties = queueProperties;
    this.supervisorProperties = supervisorProperties;
  }

  @GetMapping
  @Operation(summary = "Aggregate health", description = "200 unless the pipeline is UNHEALTHY")
  public ResponseEntity<PipelineHealth> health() {
    PipelineHealth health = metricsAggregator.evaluateHealth();
    HttpStatus status = health.isUnhealthy() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
    return ResponseEntity.status(status).body(health);
  }

  @GetMapping("/detailed")
  @Operation(summary = "Detailed health", description = "Metrics, configuration and stream detail")
  public DetailedHealthResponse detailed() {
    List<StreamDetailResponse> streams =
        supervisor.list().stream()
            .map(
                stream ->
                    new StreamDetailResponse(
                        stream,
                        healthMonitor.inspect(stream.id()).orElse(null),
                        kibanaUrlGenerator.generateStreamUrl(stream.id())))
            .collect(Collectors.toList());

    return new DetailedHealthResponse(
        metricsAggregator.evaluateHealth(),
        queue.status(),
        streams,
        chunkScheduler.schedules(),
        configuration());
  }

  private Map<String, Object> configuration() {
    Map<String, Object> configuration = new LinkedHashMap<>();
    configuration.put("chunkDuration", chunkingProperties.duration());
    configuration.put("chunkOverlap", chunkingProperties.overlap());
    configuration.put("processingDelay", chunkingProperties.processingDelay().toString());
    configuration.put("maxConcurrentExtractions", chunkingProperties.maxConcurrentExtractions());
    configuration.put("queueConcurrency", queueProperties.concurrency());
    configuration.put("maxQueueSize", queueProperties.maxSize());
    configuration.put("maxAttempts", queueProperties.maxAttempts());
    configuration.put("maxStreams", supervisorProperties.maxStreams());
    configuration.put("maxRestarts", supervisorProperties.maxRestarts());
    return configuration;
  }
}
