package com.scholary.livefeed.chunking;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for periodic chunk extraction.
 *
 * <p>Durations of the chunks themselves are whole seconds, matching the offsets they produce.
 * The extraction timeout is independent of the chunk duration.
 */
@ConfigurationProperties(prefix = "chunking")
@Validated
public record ChunkingProperties(
    @Positive int duration,
    @PositiveOrZero int overlap,
    @NotNull Duration processingDelay,
    @NotNull Duration extractionTimeout,
    @NotBlank String outputDir,
    @Positive int maxConcurrentExtractions) {

  public ChunkingProperties {
    if (overlap >= duration) {
      throw new IllegalArgumentException(
          String.format(
              "Overlap (%ss) must be less than chunk duration (%ss)", overlap, duration));
    }
  }

  /** Distance between consecutive chunk offsets, in seconds. */
  public int step() {
    return duration - overlap;
  }
}
