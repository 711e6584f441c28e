package com.scholary.livefeed.config;

import com.scholary.livefeed.chunking.ChunkingProperties;
import com.scholary.livefeed.queue.QueueProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for the thread pools behind the pipeline.
 *
 * <p>Three pools, each bounded:
 *
 * <ul>
 *   <li>{@code controlScheduler}: timers for start verification, restart backoff, health checks,
 *       chunk ticks and retention sweeps
 *   <li>{@code extractionExecutor}: blocking chunk extractions, at most one subprocess per thread
 *   <li>{@code detectionWorkerExecutor}: the processing queue workers, one thread per worker
 * </ul>
 *
 * <p>Chunk extraction and detection calls never run on the control scheduler. Crash and health
 * restarts do: each waits up to {@code supervisor.restart-kill-wait} for the old transcoder to
 * exit before relaunching, so a health round with several stale streams holds a control thread
 * for that long per stream.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "controlScheduler")
  public ThreadPoolTaskScheduler controlScheduler(
      @Value("${control.scheduler-threads:2}") int threads) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(threads);
    scheduler.setThreadNamePrefix("control-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();
    return scheduler;
  }

  @Bean(name = "extractionExecutor")
  public ThreadPoolTaskExecutor extractionExecutor(ChunkingProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.maxConcurrentExtractions());
    executor.setMaxPoolSize(properties.maxConcurrentExtractions());
    executor.setQueueCapacity(properties.maxConcurrentExtractions() * 4);
    executor.setThreadNamePrefix("extract-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "detectionWorkerExecutor")
  public ThreadPoolTaskExecutor detectionWorkerExecutor(QueueProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.concurrency());
    executor.setMaxPoolSize(properties.concurrency());
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("detect-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
