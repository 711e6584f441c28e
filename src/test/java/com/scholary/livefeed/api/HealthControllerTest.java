package com.scholary.livefeed.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.livefeed.chunking.ChunkScheduler;
import com.scholary.livefeed.chunking.ChunkingProperties;
import com.scholary.livefeed.config.TimeConfig;
import com.scholary.livefeed.health.HealthMonitor;
import com.scholary.livefeed.metrics.MetricsAggregator;
import com.scholary.livefeed.metrics.PipelineHealth;
import com.scholary.livefeed.metrics.PipelineMetrics;
import com.scholary.livefeed.monitoring.KibanaUrlGenerator;
import com.scholary.livefeed.queue.ProcessingQueue;
import com.scholary.livefeed.queue.QueueProperties;
import com.scholary.livefeed.queue.QueueStatus;
import com.scholary.livefeed.supervisor.ProcessSupervisor;
import com.scholary.livefeed.supervisor.SupervisorProperties;
import com.scholary.livefeed.support.TestProperties;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(HealthController.class)
@Import({TimeConfig.class, HealthControllerTest.PropertiesConfig.class})
class HealthControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private MetricsAggregator metricsAggregator;
  @MockBean private ProcessingQueue queue;
  @MockBean private ProcessSupervisor supervisor;
  @MockBean private ChunkScheduler chunkScheduler;
  @MockBean private HealthMonitor healthMonitor;
  @MockBean private KibanaUrlGenerator kibanaUrlGenerator;

  @Test
  void health_unhealthy_returns503() throws Exception {
    when(metricsAggregator.evaluateHealth())
        .thenReturn(health(PipelineHealth.Status.UNHEALTHY, "Processing queue is full (1000)"));

    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.status").value("UNHEALTHY"))
        .andExpect(jsonPath("$.issues[0]").value("Processing queue is full (1000)"));
  }

  @Test
  void health_degraded_stillReturns200() throws Exception {
    when(metricsAggregator.evaluateHealth())
        .thenReturn(health(PipelineHealth.Status.DEGRADED, "No stream is being chunked"));

    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("DEGRADED"))
        .andExpect(jsonPath("$.metrics.queueDepth").value(0));
  }

  @Test
  void detailed_includesQueueAndConfiguration() throws Exception {
    when(metricsAggregator.evaluateHealth()).thenReturn(health(PipelineHealth.Status.HEALTHY));
    when(queue.status()).thenReturn(new QueueStatus(2, 1, 3, 40, 2, 1000));
    when(supervisor.list()).thenReturn(List.of());
    when(chunkScheduler.schedules()).thenReturn(List.of());

    mockMvc
        .perform(get("/api/health/detailed"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.health.status").value("HEALTHY"))
        .andExpect(jsonPath("$.queue.waiting").value(2))
        .andExpect(jsonPath("$.queue.processing").value(3))
        .andExpect(jsonPath("$.configuration.chunkDuration").value(10))
        .andExpect(jsonPath("$.configuration.chunkOverlap").value(1))
        .andExpect(jsonPath("$.configuration.maxQueueSize").value(1000))
        .andExpect(jsonPath("$.configuration.maxRestarts").value(3));
  }

  private static PipelineHealth health(PipelineHealth.Status status, String... issues) {
    PipelineMetrics metrics =
        new PipelineMetrics(0, 0, 0, 0, 0.0, 0.0, 0, 0, 1, 0, Instant.now());
    return new PipelineHealth(status, List.of(issues), metrics);
  }

  @TestConfiguration
  static class PropertiesConfig {

    @Bean
    ChunkingProperties chunkingProperties() {
      return TestProperties.chunking(Paths.get("target", "test-livefeed"));
    }

    @Bean
    QueueProperties queueProperties() {
      return TestProperties.queue(1000, 3);
    }

    @Bean
    SupervisorProperties supervisorProperties() {
      return TestProperties.supervisor(Paths.get("target", "test-livefeed"));
    }
  }
}
