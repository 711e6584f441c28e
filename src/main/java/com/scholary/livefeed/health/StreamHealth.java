package com.scholary.livefeed.health;

import java.time.Duration;

/**
 * Result of inspecting one stream's playlist.
 *
 * @param age time since the playlist was last written, or null if it does not exist
 * @param reason why the stream is unhealthy, or null when healthy
 */
public record StreamHealth(
    boolean healthy, boolean playlistExists, int segmentCount, Duration age, String reason) {

  static StreamHealth healthy(int segmentCount, Duration age) {
    return new StreamHealth(true, true, segmentCount, age, null);
  }

  static StreamHealth unhealthy(boolean exists, int segmentCount, Duration age, String reason) {
    return new StreamHealth(false, exists, segmentCount, age, reason);
  }
}
