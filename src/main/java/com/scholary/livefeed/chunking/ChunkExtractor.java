package com.scholary.livefeed.chunking;

import com.scholary.livefeed.logging.StructuredLogger;
import com.scholary.livefeed.process.FfmpegProperties;
import com.scholary.livefeed.process.TranscoderLauncher;
import com.scholary.livefeed.process.TranscoderProcess;
import com.scholary.livefeed.source.SourceAdapter;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cuts fixed-length chunks out of a live source with ffmpeg.
 *
 * <p>Streams are copied, not re-encoded, so an extraction normally takes a fraction of the chunk
 * duration. It still runs under a hard timeout: a live source that stops sending data leaves
 * ffmpeg waiting forever. On any failure the partial output is deleted, so every chunk file
 * left on disk is complete.
 */
@Component
public class ChunkExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkExtractor.class);

  private final TranscoderLauncher launcher;
  private final ChunkingProperties properties;
  private final String ffmpegBinary;
  private final Path outputDir;
  private final Clock clock;
  private final StructuredLogger structuredLogger;
  private final Set<TranscoderProcess> inFlight = ConcurrentHashMap.newKeySet();

  public ChunkExtractor(
      TranscoderLauncher launcher,
      ChunkingProperties properties,
      FfmpegProperties ffmpegProperties,
      Clock clock) {
    this.launcher = launcher;
    this.properties = properties;
    this.ffmpegBinary = ffmpegProperties.binary();
    this.outputDir = Paths.get(properties.outputDir()).toAbsolutePath();
    this.clock = clock;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  /**
   * Extract one chunk.
   *
   * @param streamId the stream the chunk belongs to
   * @param locator what ffmpeg reads: a playlist, file or feed URI
   * @param offsetSeconds where the chunk starts
   * @return a READY chunk with its size
   * @throws ExtractionTimeoutException if ffmpeg ran past the extraction timeout
   * @throws ChunkExtractionException if ffmpeg failed or produced no output; carries the chunk
   *     in ERROR
   */
  public ChunkDescriptor extract(String streamId, String locator, long offsetSeconds) {
    String chunkId = UUID.randomUUID().toString();
    Path file = outputDir.resolve(ChunkFileNames.fileName(streamId, chunkId, offsetSeconds));
    ChunkDescriptor chunk =
        ChunkDescriptor.extracting(chunkId, streamId, offsetSeconds, properties.duration(), file);

    List<String> command = buildCommand(locator, offsetSeconds, file);
    LOGGER.debug("Extracting chunk {}: {}", chunkId, SourceAdapter.redactCommand(command));

    long startMillis = clock.millis();
    TranscoderProcess process = null;
    try {
      try {
        Files.createDirectories(outputDir);
      } catch (IOException e) {
        throw new ChunkExtractionException("Failed to create chunk directory " + outputDir, e);
      }
      try {
        process = launcher.launch(command, streamId + "-" + offsetSeconds);
      } catch (IOException e) {
        throw new ChunkExtractionException("Failed to start ffmpeg: " + e.getMessage(), e);
      }
      inFlight.add(process);

      int exitCode = awaitExit(process, streamId, offsetSeconds);
      if (exitCode != 0) {
        throw new ChunkExtractionException(
            String.format("ffmpeg exited with code %d: %s", exitCode, process.outputTail()));
      }

      long size = sizeOf(file);
      if (size == 0) {
        throw new ChunkExtractionException(
            String.format("ffmpeg produced no output for %s at %ds", streamId, offsetSeconds));
      }

      ChunkDescriptor ready = chunk.ready(size, clock.instant());
      structuredLogger.logChunkExtracted(
          streamId, chunkId, offsetSeconds, size, clock.millis() - startMillis);
      return ready;

    } catch (ChunkExtractionException e) {
      deletePartial(file);
      e.setChunk(chunk.failed(e.getMessage(), clock.instant()));
      throw e;
    } finally {
      if (process != null) {
        inFlight.remove(process);
      }
    }
  }

  /** Number of extractions currently running. */
  public int inFlightCount() {
    return inFlight.size();
  }

  public Path outputDir() {
    return outputDir;
  }

  /**
   * Locate a chunk file by chunk id.
   *
   * @param chunkId the chunk id
   * @return a READY descriptor built from the file, or empty if no such chunk is on disk
   */
  public Optional<ChunkDescriptor> findChunk(String chunkId) {
    if (!Files.isDirectory(outputDir)) {
      return Optional.empty();
    }
    try (Stream<Path> files = Files.list(outputDir)) {
      return files
          .filter(Files::isRegularFile)
          .map(path -> toDescriptor(path, chunkId))
          .flatMap(Optional::stream)
          .findFirst();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list chunk directory " + outputDir, e);
    }
  }

  /** Kill every running extraction. */
  @PreDestroy
  public void shutdown() {
    if (!inFlight.isEmpty()) {
      LOGGER.info("Killing {} in-flight extractions", inFlight.size());
    }
    for (TranscoderProcess process : inFlight) {
      process.kill();
    }
  }

  List<String> buildCommand(String locator, long offsetSeconds, Path file) {
    return List.of(
        ffmpegBinary,
        "-ss", String.valueOf(offsetSeconds),
        "-i", locator,
        "-t", String.valueOf(properties.duration()),
        "-c", "copy",
        "-avoid_negative_ts", "make_zero",
        "-f", "mp4",
        "-y",
        file.toString());
  }

  private int awaitExit(TranscoderProcess process, String streamId, long offsetSeconds) {
    long timeoutMillis = properties.extractionTimeout().toMillis();
    try {
      return process.exit().get(timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      process.kill();
      throw new ExtractionTimeoutException(
          String.format(
              "Extraction of %s at %ds timed out after %dms",
              streamId, offsetSeconds, timeoutMillis),
          e);
    } catch (ExecutionException e) {
      throw new ChunkExtractionException("ffmpeg exit could not be observed", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.kill();
      throw new ChunkExtractionException("Extraction interrupted", e);
    }
  }

  private long sizeOf(Path file) {
    try {
      return Files.exists(file) ? Files.size(file) : 0L;
    } catch (IOException e) {
      throw new ChunkExtractionException("Failed to stat chunk file " + file, e);
    }
  }

  private void deletePartial(Path file) {
    try {
      if (Files.deleteIfExists(file)) {
        LOGGER.debug("Deleted partial chunk {}", file.getFileName());
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to delete partial chunk {}: {}", file, e.getMessage());
    }
  }

  private Optional<ChunkDescriptor> toDescriptor(Path path, String chunkId) {
    return ChunkFileNames.parse(path.getFileName().toString())
        .filter(name -> name.chunkId().equals(chunkId))
        .map(
            name -> {
              try {
                return new ChunkDescriptor(
                    name.chunkId(),
                    name.streamId(),
                    name.offsetSeconds(),
                    properties.duration(),
                    path,
                    ChunkStatus.READY,
                    Files.size(path),
                    Files.getLastModifiedTime(path).toInstant(),
                    null);
              } catch (IOException e) {
                throw new UncheckedIOException(e);
              }
            });
  }
}
