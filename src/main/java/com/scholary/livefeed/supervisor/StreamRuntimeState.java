package com.scholary.livefeed.supervisor;

import com.scholary.livefeed.process.TranscoderProcess;
import com.scholary.livefeed.source.StreamDescriptor;
import com.scholary.livefeed.source.StreamSource;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Mutable runtime state of one supervised stream.
 *
 * <p>Owned by {@link ProcessSupervisor}. Every access happens while holding this object's
 * monitor; the methods themselves do not lock. Other components only ever see {@link
 * StreamSnapshot}s.
 */
final class StreamRuntimeState {

  private final StreamDescriptor descriptor;
  private final StreamSource source;
  private final Path outputDirectory;
  private final String playlistUrl;

  private StreamStatus status = StreamStatus.STARTING;
  private TranscoderProcess process;
  private Instant startedAt;
  private int restartCount;
  private String lastError;
  private boolean manuallyStopped;
  private ScheduledFuture<?> pendingRestart;

  StreamRuntimeState(
      StreamDescriptor descriptor, StreamSource source, Path outputDirectory, String playlistUrl) {
    this.descriptor = descriptor;
    this.source = source;
    this.outputDirectory = outputDirectory;
    this.playlistUrl = playlistUrl;
  }

  String id() {
    return descriptor.id();
  }

  StreamDescriptor descriptor() {
    return descriptor;
  }

  StreamSource source() {
    return source;
  }

  Path outputDirectory() {
    return outputDirectory;
  }

  Path playlist() {
    return outputDirectory.resolve(HlsCommandBuilder.PLAYLIST_NAME);
  }

  StreamStatus status() {
    return status;
  }

  /**
   * Move to a new status.
   *
   * @throws IllegalStateException if the transition is not allowed
   */
  void transitionTo(StreamStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new IllegalStateException(
          String.format("Stream %s cannot go from %s to %s", id(), status, target));
    }
    status = target;
  }

  TranscoderProcess process() {
    return process;
  }

  void attach(TranscoderProcess process, Instant startedAt) {
    this.process = process;
    this.startedAt = startedAt;
  }

  /** Forget the current process and return it. Its exit is then ignored. */
  TranscoderProcess detach() {
    TranscoderProcess current = process;
    process = null;
    return current;
  }

  int restartCount() {
    return restartCount;
  }

  void incrementRestartCount() {
    restartCount++;
  }

  void resetRestartCount() {
    restartCount = 0;
  }

  String lastError() {
    return lastError;
  }

  void recordError(String error) {
    this.lastError = error;
  }

  boolean isManuallyStopped() {
    return manuallyStopped;
  }

  void markManuallyStopped() {
    manuallyStopped = true;
  }

  void clearManualStop() {
    manuallyStopped = false;
  }

  void schedulePendingRestart(ScheduledFuture<?> future) {
    cancelPendingRestart();
    pendingRestart = future;
  }

  void cancelPendingRestart() {
    if (pendingRestart != null) {
      pendingRestart.cancel(false);
      pendingRestart = null;
    }
  }

  StreamSnapshot snapshot() {
    return new StreamSnapshot(
        descriptor.id(),
        descriptor.name(),
        descriptor.source().describe(),
        status,
        process == null ? null : process.pid(),
        startedAt,
        restartCount,
        lastError,
        manuallyStopped,
        outputDirectory.toString(),
        playlistUrl);
  }
}
