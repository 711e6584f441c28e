package com.scholary.livefeed.health;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether an HLS playlist is being kept up to date.
 *
 * <p>A playlist is healthy when it exists, lists at least one segment and was written less than
 * {@code health.freshness-threshold} ago. ffmpeg rewrites it on every segment, so a stale file
 * means the encoder is stuck even if the process is still alive.
 */
@Component
public class PlaylistInspector {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlaylistInspector.class);

  private final Clock clock;
  private final Duration freshnessThreshold;

  public PlaylistInspector(Clock clock, HealthProperties properties) {
    this.clock = clock;
    this.freshnessThreshold = properties.freshnessThreshold();
  }

  public StreamHealth inspect(Path playlist) {
    if (playlist == null || !Files.isRegularFile(playlist)) {
      return StreamHealth.unhealthy(false, 0, null, "Playlist does not exist");
    }

    List<String> lines;
    Duration age;
    try {
      lines = Files.readAllLines(playlist, StandardCharsets.UTF_8);
      age =
          Duration.between(Files.getLastModifiedTime(playlist).toInstant(), clock.instant());
    } catch (IOException e) {
      LOGGER.warn("Failed to read playlist {}: {}", playlist, e.getMessage());
      return StreamHealth.unhealthy(true, 0, null, "Playlist unreadable: " + e.getMessage());
    }

    int segments = (int) lines.stream().map(String::trim).filter(l -> l.endsWith(".ts")).count();
    if (segments == 0) {
      return StreamHealth.unhealthy(true, 0, age, "Playlist lists no segments");
    }
    if (age.compareTo(freshnessThreshold) >= 0) {
      return StreamHealth.unhealthy(
          true,
          segments,
          age,
          String.format(
              "Playlist not updated for %ds (threshold %ds)",
              age.getSeconds(), freshnessThreshold.getSeconds()));
    }
    return StreamHealth.healthy(segments, age);
  }
}
