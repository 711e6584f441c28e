package com.scholary.livefeed.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.scholary.livefeed.chunking.ChunkDescriptor;
import com.scholary.livefeed.chunking.ChunkStatus;
import com.scholary.livefeed.detection.DetectionResult;
import com.scholary.livefeed.detection.DetectionService;
import com.scholary.livefeed.metrics.PipelineCounters;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
class QueueWorkerPoolTest {

  private static final int CONCURRENCY = 2;

  @Mock private DetectionService detectionService;

  private ThreadPoolTaskExecutor executor;
  private ProcessingQueue queue;
  private QueueWorkerPool pool;

  @BeforeEach
  void setUp() {
    QueueProperties properties =
        new QueueProperties(
            CONCURRENCY, 100, 3, Duration.ofSeconds(2), 100, Duration.ofHours(1));
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(CONCURRENCY);
    executor.setMaxPoolSize(CONCURRENCY);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("detect-test-");
    executor.initialize();
    queue =
        new ProcessingQueue(
            detectionService,
            new JobHistory(properties),
            properties,
            new PipelineCounters(),
            Clock.systemUTC());
    pool = new QueueWorkerPool(queue, executor, properties);
  }

  @AfterEach
  void tearDown() {
    pool.stop();
    executor.shutdown();
  }

  @Test
  void workers_neverExceedConcurrency() throws Exception {
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger maxInFlight = new AtomicInteger();
    CountDownLatch saturated = new CountDownLatch(CONCURRENCY);
    CountDownLatch release = new CountDownLatch(1);
    when(detectionService.process(any()))
        .thenAnswer(
            invocation -> {
              int current = inFlight.incrementAndGet();
              maxInFlight.accumulateAndGet(current, Math::max);
              saturated.countDown();
              release.await(5, TimeUnit.SECONDS);
              inFlight.decrementAndGet();
              return result();
            });
    for (int i = 0; i < 6; i++) {
      queue.enqueue(chunk(i));
    }

    pool.start();

    assertThat(saturated.await(5, TimeUnit.SECONDS)).isTrue();
    Thread.sleep(200);
    assertThat(maxInFlight.get()).isEqualTo(CONCURRENCY);
    assertThat(queue.status().processing()).isEqualTo(CONCURRENCY);

    release.countDown();
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (queue.status().completed() < 6 && System.nanoTime() < deadline) {
      Thread.sleep(20);
    }
    assertThat(queue.status().completed()).isEqualTo(6);
    assertThat(maxInFlight.get()).isEqualTo(CONCURRENCY);
  }

  @Test
  void stop_releasesIdleWorkersPromptly() throws Exception {
    pool.start();
    assertThat(pool.isRunning()).isTrue();
    Thread.sleep(100);

    long start = System.nanoTime();
    pool.stop();
    executor.getThreadPoolExecutor().shutdown();
    boolean terminated = executor.getThreadPoolExecutor().awaitTermination(5, TimeUnit.SECONDS);

    assertThat(terminated).isTrue();
    assertThat(pool.isRunning()).isFalse();
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(3));
  }

  @Test
  void stop_isPartOfTheExecutorLifecyclePhase() {
    assertThat(pool.isAutoStartup()).isTrue();
    assertThat(pool.getPhase()).isEqualTo(executor.getPhase());
  }

  private static ChunkDescriptor chunk(long second) {
    return new ChunkDescriptor(
        UUID.randomUUID().toString(),
        "cam1",
        second * 9,
        10,
        Paths.get("cam1_" + second + ".mp4"),
        ChunkStatus.READY,
        1024L,
        Instant.parse("2024-05-01T12:00:00Z").plusSeconds(second),
        null);
  }

  private static DetectionResult result() {
    return new DetectionResult("c1", "cam1", "completed", 120, List.of(), null, null);
  }
}
