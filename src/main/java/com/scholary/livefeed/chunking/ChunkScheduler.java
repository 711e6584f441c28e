package com.scholary.livefeed.chunking;

import com.scholary.livefeed.logging.StructuredLogger;
import com.scholary.livefeed.metrics.PipelineCounters;
import com.scholary.livefeed.queue.ProcessingQueue;
import com.scholary.livefeed.queue.QueueFullException;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Periodically extracts chunks from live streams and queues them for detection.
 *
 * <p>Each stream gets a fixed-rate ticket on the control scheduler with a period of {@code
 * duration - overlap} seconds. A tick only takes the next offset and hands the extraction to the
 * extraction executor; the control thread never waits on ffmpeg.
 *
 * <p>With a 10s duration and 1s overlap, chunks start at 0, 9, 18, ... seconds. A failed
 * extraction is counted and its interval skipped: the offset is never rewound.
 */
@Service
public class ChunkScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkScheduler.class);

  private final ChunkExtractor extractor;
  private final ProcessingQueue queue;
  private final PipelineCounters counters;
  private final ChunkingProperties properties;
  private final TaskScheduler scheduler;
  private final TaskExecutor extractionExecutor;
  private final Clock clock;
  private final StructuredLogger structuredLogger;
  private final Map<String, SchedulingTicket> tickets = new ConcurrentHashMap<>();

  public ChunkScheduler(
      ChunkExtractor extractor,
      ProcessingQueue queue,
      PipelineCounters counters,
      ChunkingProperties properties,
      @Qualifier("controlScheduler") TaskScheduler scheduler,
      @Qualifier("extractionExecutor") TaskExecutor extractionExecutor,
      Clock clock) {
    this.extractor = extractor;
    this.queue = queue;
    this.counters = counters;
    this.properties = properties;
    this.scheduler = scheduler;
    this.extractionExecutor = extractionExecutor;
    this.clock = clock;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  /**
   * Start periodic extraction for a stream.
   *
   * <p>The first extraction runs after {@code chunking.processing-delay}, giving a live source
   * time to buffer.
   *
   * @param streamId the stream
   * @param locator what to extract from
   * @param seedOffset offset of the first chunk, in seconds
   * @return the new schedule
   * @throws ChunkSchedulingException if the stream is already being chunked
   */
  public ScheduleSnapshot start(String streamId, String locator, long seedOffset) {
    if (seedOffset < 0) {
      throw new IllegalArgumentException("Seed offset must not be negative: " + seedOffset);
    }
    SchedulingTicket ticket = new SchedulingTicket(streamId, locator, seedOffset, clock.instant());
    if (tickets.putIfAbsent(streamId, ticket) != null) {
      throw new ChunkSchedulingException("Stream " + streamId + " is already being processed");
    }

    try {
      ticket.attach(
          scheduler.scheduleAtFixedRate(
              () -> tick(ticket),
              clock.instant().plus(properties.processingDelay()),
              Duration.ofSeconds(properties.step())));
    } catch (RuntimeException e) {
      tickets.remove(streamId, ticket);
      throw new ChunkSchedulingException("Failed to schedule chunking for " + streamId, e);
    }

    LOGGER.info(
        "Chunking stream {} every {}s ({}s chunks, {}s overlap) from offset {}",
        streamId,
        properties.step(),
        properties.duration(),
        properties.overlap(),
        seedOffset);
    return ticket.snapshot();
  }

  /**
   * Stop periodic extraction for a stream. Extractions already running finish; ticks not yet
   * started do nothing.
   *
   * @return false if the stream was not being chunked
   */
  public boolean stop(String streamId) {
    SchedulingTicket ticket = tickets.remove(streamId);
    if (ticket == null) {
      return false;
    }
    ticket.cancel();
    LOGGER.info("Stopped chunking stream {}", streamId);
    return true;
  }

  public boolean isScheduled(String streamId) {
    return tickets.containsKey(streamId);
  }

  public Optional<ScheduleSnapshot> schedule(String streamId) {
    return Optional.ofNullable(tickets.get(streamId)).map(SchedulingTicket::snapshot);
  }

  public List<ScheduleSnapshot> schedules() {
    return tickets.values().stream()
        .map(SchedulingTicket::snapshot)
        .collect(Collectors.toList());
  }

  public int scheduledCount() {
    return tickets.size();
  }

  @PreDestroy
  public void shutdown() {
    for (String streamId : new ArrayList<>(tickets.keySet())) {
      stop(streamId);
    }
  }

  void tick(SchedulingTicket ticket) {
    if (ticket.isCancelled()) {
      return;
    }
    long offset = ticket.takeOffset(properties.step());
    try {
      extractionExecutor.execute(() -> extractAndQueue(ticket, offset));
    } catch (TaskRejectedException e) {
      ticket.recordFailed();
      counters.recordExtractionFailure();
      structuredLogger.logChunkFailed(
          ticket.streamId(), offset, "rejected", "Extraction executor is saturated");
    }
  }

  private void extractAndQueue(SchedulingTicket ticket, long offset) {
    if (ticket.isCancelled()) {
      return;
    }
    StructuredLogger.setStreamContext(ticket.streamId());
    try {
      long startMillis = clock.millis();
      ChunkDescriptor chunk = extractor.extract(ticket.streamId(), ticket.locator(), offset);
      counters.recordExtraction(clock.millis() - startMillis);
      ticket.recordExtracted();

      try {
        queue.enqueue(chunk);
      } catch (QueueFullException e) {
        ticket.recordFailed(chunk.failed(e.getMessage(), clock.instant()));
        counters.recordExtractionFailure();
        LOGGER.warn(
            "Dropped chunk {} of stream {}: {}", chunk.id(), ticket.streamId(), e.getMessage());
      }
    } catch (ExtractionTimeoutException e) {
      recordFailure(ticket, offset, "timeout", e);
    } catch (ChunkExtractionException e) {
      recordFailure(ticket, offset, "extraction", e);
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected failure extracting {} at {}s", ticket.streamId(), offset, e);
      ticket.recordFailed();
      counters.recordExtractionFailure();
      structuredLogger.logChunkFailed(ticket.streamId(), offset, "unexpected", e.getMessage());
    } finally {
      StructuredLogger.clearStreamContext();
    }
  }

  private void recordFailure(
      SchedulingTicket ticket, long offset, String errorType, ChunkExtractionException e) {
    if (e.chunk().isPresent()) {
      ticket.recordFailed(e.chunk().get());
    } else {
      ticket.recordFailed();
    }
    counters.recordExtractionFailure();
    structuredLogger.logChunkFailed(ticket.streamId(), offset, errorType, e.getMessage());
  }
}
