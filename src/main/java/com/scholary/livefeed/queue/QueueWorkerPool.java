package com.scholary.livefeed.queue;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Fixed set of workers draining the {@link ProcessingQueue}.
 *
 * <p>One long-running loop per {@code queue.concurrency} on the detection worker executor, so at
 * most that many detection calls are in flight at any time.
 *
 * <p>The pool shares the executor's lifecycle phase and depends on it, so on context close the
 * loops are told to exit before the executor waits for its tasks.
 */
@Component
public class QueueWorkerPool implements SmartLifecycle {

  private static final Logger LOGGER = LoggerFactory.getLogger(QueueWorkerPool.class);

  private static final Duration IDLE_WAIT = Duration.ofSeconds(1);

  private final ProcessingQueue queue;
  private final TaskExecutor executor;
  private final int concurrency;

  private volatile boolean running;

  public QueueWorkerPool(
      ProcessingQueue queue,
      @Qualifier("detectionWorkerExecutor") TaskExecutor executor,
      QueueProperties properties) {
    this.queue = queue;
    this.executor = executor;
    this.concurrency = properties.concurrency();
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    for (int i = 0; i < concurrency; i++) {
      executor.execute(this::runWorker);
    }
    LOGGER.info("Started {} queue workers", concurrency);
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    queue.wakeAll();
    LOGGER.info("Stopping queue workers");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  private void runWorker() {
    while (running && !Thread.currentThread().isInterrupted()) {
      try {
        if (!queue.processNext()) {
          queue.awaitWork(IDLE_WAIT);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (RuntimeException e) {
        LOGGER.error("Queue worker failed, continuing", e);
      }
    }
    LOGGER.debug("Queue worker {} exiting", Thread.currentThread().getName());
  }
}
