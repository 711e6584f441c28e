package com.scholary.livefeed.retention;

import com.scholary.livefeed.chunking.ChunkExtractor;
import com.scholary.livefeed.detection.DetectionProperties;
import com.scholary.livefeed.process.FfmpegProperties;
import com.scholary.livefeed.supervisor.ProcessSupervisor;
import com.scholary.livefeed.supervisor.StreamSnapshot;
import com.scholary.livefeed.supervisor.StreamStatus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Deletes media that is no longer needed.
 *
 * <ul>
 *   <li>chunk files and processed output older than {@code retention.chunk-retention}
 *   <li>HLS segments of active streams beyond the newest {@code playlist-size}, once more than
 *       twice that many have piled up
 * </ul>
 *
 * <p>A file that cannot be deleted is logged and skipped.
 */
@Component
public class RetentionSweeper {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetentionSweeper.class);

  private final Path chunkDir;
  private final Path processedDir;
  private final ProcessSupervisor supervisor;
  private final int playlistSize;
  private final RetentionProperties properties;
  private final TaskScheduler scheduler;
  private final Clock clock;

  private final List<ScheduledFuture<?>> tasks = new ArrayList<>();

  public RetentionSweeper(
      ChunkExtractor extractor,
      DetectionProperties detectionProperties,
      ProcessSupervisor supervisor,
      FfmpegProperties ffmpegProperties,
      RetentionProperties properties,
      @Qualifier("controlScheduler") TaskScheduler scheduler,
      Clock clock) {
    this.chunkDir = extractor.outputDir();
    this.processedDir = Paths.get(detectionProperties.processedOutputDir()).toAbsolutePath();
    this.supervisor = supervisor;
    this.playlistSize = ffmpegProperties.playlistSize();
    this.properties = properties;
    this.scheduler = scheduler;
    this.clock = clock;
  }

  @PostConstruct
  public void schedule() {
    Instant now = clock.instant();
    tasks.add(
        scheduler.scheduleAtFixedRate(
            this::runScheduledSweep,
            now.plus(properties.sweepInterval()),
            properties.sweepInterval()));
    tasks.add(
        scheduler.scheduleAtFixedRate(
            this::runScheduledTrim,
            now.plus(properties.segmentSweepInterval()),
            properties.segmentSweepInterval()));
  }

  @PreDestroy
  public void cancel() {
    for (ScheduledFuture<?> task : tasks) {
      if (task != null) {
        task.cancel(false);
      }
    }
  }

  /** Run a full sweep now. */
  public SweepReport sweep() {
    Instant cutoff = clock.instant().minus(properties.chunkRetention());
    long[] bytes = new long[1];

    int chunks = deleteOlderThan(chunkDir, cutoff, isFile(".mp4"), bytes);
    int processed =
        deleteOlderThan(processedDir, cutoff, isFile(".mp4").or(isFile(".json")), bytes);
    int segments = trimSegments(bytes);

    SweepReport report = new SweepReport(chunks, processed, segments, bytes[0], clock.instant());
    if (report.filesDeleted() > 0) {
      LOGGER.info(
          "Retention sweep deleted {} chunks, {} processed files, {} segments ({} bytes)",
          chunks,
          processed,
          segments,
          report.bytesFreed());
    }
    return report;
  }

  /** Trim segment directories of active streams. Returns the number of segments deleted. */
  public int trimSegments() {
    return trimSegments(new long[1]);
  }

  private void runScheduledSweep() {
    try {
      sweep();
    } catch (RuntimeException e) {
      LOGGER.error("Retention sweep failed", e);
    }
  }

  private void runScheduledTrim() {
    try {
      trimSegments();
    } catch (RuntimeException e) {
      LOGGER.error("Segment cleanup failed", e);
    }
  }

  private int trimSegments(long[] bytes) {
    int deleted = 0;
    for (StreamSnapshot stream : supervisor.list()) {
      if (stream.status() != StreamStatus.ACTIVE) {
        continue;
      }
      try {
        deleted += trimSegmentDirectory(Paths.get(stream.outputDirectory()), bytes);
      } catch (IOException e) {
        LOGGER.warn("Segment cleanup failed for stream {}: {}", stream.id(), e.getMessage());
      }
    }
    return deleted;
  }

  int trimSegmentDirectory(Path directory, long[] bytes) throws IOException {
    if (!Files.isDirectory(directory)) {
      return 0;
    }
    List<Path> segments;
    try (Stream<Path> files = Files.list(directory)) {
      segments =
          files
              .filter(isFile(".ts"))
              .sorted(
                  Comparator.comparing(RetentionSweeper::lastModified)
                      .thenComparing(Path::toString))
              .collect(Collectors.toList());
    }
    if (segments.size() <= playlistSize * 2) {
      return 0;
    }

    int deleted = 0;
    for (Path segment : segments.subList(0, segments.size() - playlistSize)) {
      if (delete(segment, bytes)) {
        deleted++;
      }
    }
    LOGGER.debug(
        "Trimmed {} old segments in {}, {} left", deleted, directory, segments.size() - deleted);
    return deleted;
  }

  private int deleteOlderThan(
      Path directory, Instant cutoff, Predicate<Path> filter, long[] bytes) {
    if (!Files.isDirectory(directory)) {
      return 0;
    }
    List<Path> expired;
    try (Stream<Path> files = Files.list(directory)) {
      expired =
          files
              .filter(filter)
              .filter(path -> lastModified(path).toInstant().isBefore(cutoff))
              .collect(Collectors.toList());
    } catch (IOException e) {
      LOGGER.warn("Failed to list {}: {}", directory, e.getMessage());
      return 0;
    }

    int deleted = 0;
    for (Path path : expired) {
      if (delete(path, bytes)) {
        deleted++;
      }
    }
    return deleted;
  }

  private boolean delete(Path path, long[] bytes) {
    try {
      long size = Files.size(path);
      if (Files.deleteIfExists(path)) {
        bytes[0] += size;
        return true;
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}: {}", path, e.getMessage());
    }
    return false;
  }

  private static Predicate<Path> isFile(String extension) {
    return path -> Files.isRegularFile(path) && path.getFileName().toString().endsWith(extension);
  }

  private static FileTime lastModified(Path path) {
    try {
      return Files.getLastModifiedTime(path);
    } catch (IOException e) {
      // vanished between listing and stat; sorts first and is skipped on delete
      return FileTime.fromMillis(0);
    }
  }
}
