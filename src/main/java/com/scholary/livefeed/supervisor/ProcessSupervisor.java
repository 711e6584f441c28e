package com.scholary.livefeed.supervisor;

import com.scholary.livefeed.logging.StructuredLogger;
import com.scholary.livefeed.process.TranscoderLauncher;
import com.scholary.livefeed.process.TranscoderProcess;
import com.scholary.livefeed.source.SourceAdapter;
import com.scholary.livefeed.source.StreamDescriptor;
import com.scholary.livefeed.source.StreamSource;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Keeps one ffmpeg transcoder per stream alive.
 *
 * <p>Lifecycle of a stream:
 *
 * <ol>
 *   <li>{@link #start} registers the stream and launches the transcoder (STARTING)
 *   <li>after the verification delay a still-running process makes the stream ACTIVE
 *   <li>a non-zero exit puts the stream in ERROR and schedules a crash restart, up to the cap
 *   <li>{@link #stop} terminates the process, deletes the output and unregisters the stream
 * </ol>
 *
 * <p>All state changes for a stream happen under that stream's monitor. Timers run on the
 * control scheduler; process exits arrive on whichever thread completes the exit future.
 * Neither spawn failures nor crashes are thrown to callers; they only show up in the snapshot.
 */
@Service
public class ProcessSupervisor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessSupervisor.class);

  private final StreamRegistry registry;
  private final TranscoderLauncher launcher;
  private final SourceAdapter sourceAdapter;
  private final HlsCommandBuilder commandBuilder;
  private final SupervisorProperties properties;
  private final TaskScheduler scheduler;
  private final Clock clock;
  private final Path outputRoot;
  private final StructuredLogger structuredLogger;

  public ProcessSupervisor(
      StreamRegistry registry,
      TranscoderLauncher launcher,
      SourceAdapter sourceAdapter,
      HlsCommandBuilder commandBuilder,
      SupervisorProperties properties,
      @Qualifier("controlScheduler") TaskScheduler scheduler,
      Clock clock) {
    this.registry = registry;
    this.launcher = launcher;
    this.sourceAdapter = sourceAdapter;
    this.commandBuilder = commandBuilder;
    this.properties = properties;
    this.scheduler = scheduler;
    this.clock = clock;
    this.outputRoot = Paths.get(properties.outputRoot()).toAbsolutePath();
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  /**
   * Start supervising a stream.
   *
   * <p>Returns once the transcoder has been launched (or failed to launch); the stream is
   * STARTING or ERROR at that point, never ACTIVE.
   *
   * @param descriptor the stream to start
   * @return snapshot right after launch
   * @throws StreamAlreadyExistsException if the stream is already supervised
   * @throws StreamCapacityException if the maximum number of streams is reached
   * @throws IllegalArgumentException if the source cannot be resolved
   */
  public StreamSnapshot start(StreamDescriptor descriptor) {
    StreamSource source = sourceAdapter.resolve(descriptor.source());
    Path outputDirectory = outputRoot.resolve(descriptor.id());
    StreamRuntimeState state =
        new StreamRuntimeState(descriptor, source, outputDirectory, playlistUrl(descriptor.id()));

    registry.admit(state, properties.maxStreams());

    try {
      Files.createDirectories(outputDirectory);
    } catch (IOException e) {
      registry.remove(state);
      throw new UncheckedIOException(
          "Failed to create output directory for stream " + descriptor.id(), e);
    }

    LOGGER.info(
        "Starting stream {} ({}) from {}", state.id(), descriptor.name(), source.describe());
    synchronized (state) {
      launch(state);
      return state.snapshot();
    }
  }

  /**
   * Stop a stream for good.
   *
   * <p>Sets the manual-stop flag first so nothing can bring the process back, then terminates
   * it, deletes the output directory and unregisters the stream.
   *
   * @param id the stream id
   * @return the final snapshot (STOPPED)
   * @throws StreamNotFoundException if the stream is not supervised
   */
  public StreamSnapshot stop(String id) {
    StreamRuntimeState state = require(id);
    StreamSnapshot snapshot;
    synchronized (state) {
      state.markManuallyStopped();
      state.cancelPendingRestart();
      terminate(state, properties.stopGracePeriod());
      if (state.status() != StreamStatus.STOPPED) {
        state.transitionTo(StreamStatus.STOPPED);
      }
      registry.remove(state);
      snapshot = state.snapshot();
    }
    deleteOutputDirectory(state.outputDirectory());
    LOGGER.info("Stopped stream {}", id);
    return snapshot;
  }

  /**
   * Restart a stream's transcoder.
   *
   * @param id the stream id
   * @param cause why; decides what happens to the restart counter and manual-stop flag
   * @throws StreamNotFoundException if the stream is not supervised
   */
  public void restart(String id, RestartCause cause) {
    restart(require(id), cause);
  }

  /** Current snapshot of every supervised stream. */
  public List<StreamSnapshot> list() {
    return registry.all().stream().map(this::snapshotOf).collect(Collectors.toList());
  }

  public Optional<StreamSnapshot> snapshot(String id) {
    return registry.get(id).map(this::snapshotOf);
  }

  /** Path of the stream's HLS playlist, if the stream is supervised. */
  public Optional<Path> playlistPath(String id) {
    return registry.get(id).map(StreamRuntimeState::playlist);
  }

  /** Public locator of a stream's playlist, whether or not the stream is running. */
  public String playlistUrl(String id) {
    String base = properties.publicPath();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return base + "/" + id + "/" + HlsCommandBuilder.PLAYLIST_NAME;
  }

  public Path outputRoot() {
    return outputRoot;
  }

  /** Stop every stream. Runs on application shutdown. */
  @PreDestroy
  public void shutdown() {
    List<StreamRuntimeState> states = registry.all();
    if (!states.isEmpty()) {
      LOGGER.info("Shutting down {} streams", states.size());
    }
    for (StreamRuntimeState state : states) {
      try {
        stop(state.id());
      } catch (StreamNotFoundException e) {
        LOGGER.debug("Stream {} already stopped", state.id());
      } catch (RuntimeException e) {
        LOGGER.error("Failed to stop stream {} during shutdown", state.id(), e);
      }
    }
  }

  private StreamSnapshot snapshotOf(StreamRuntimeState state) {
    synchronized (state) {
      return state.snapshot();
    }
  }

  private StreamRuntimeState require(String id) {
    return registry
        .get(id)
        .orElseThrow(() -> new StreamNotFoundException("Stream not found: " + id));
  }

  private void restart(StreamRuntimeState state, RestartCause cause) {
    synchronized (state) {
      if (!registry.isCurrent(state)) {
        LOGGER.debug("Ignoring {} restart of stream {}: no longer supervised", cause, state.id());
        return;
      }
      if (cause == RestartCause.OPERATOR) {
        state.clearManualStop();
        state.resetRestartCount();
      } else if (state.isManuallyStopped()) {
        LOGGER.info("Skipping {} restart of stream {}: manually stopped", cause, state.id());
        return;
      } else if (cause == RestartCause.CRASH) {
        state.incrementRestartCount();
      } else if (cause == RestartCause.RECOVERY) {
        state.resetRestartCount();
      }

      structuredLogger.logStreamRestart(
          state.id(), cause.name(), state.restartCount(), properties.maxRestarts());

      state.cancelPendingRestart();
      terminate(state, properties.restartKillWait());
      launch(state);
    }
  }

  /** Launch a transcoder for the state. Caller holds the state's monitor. */
  private void launch(StreamRuntimeState state) {
    if (state.status() != StreamStatus.STARTING) {
      state.transitionTo(StreamStatus.STARTING);
    }

    List<String> command =
        commandBuilder.build(sourceAdapter.inputArguments(state.source()), state.outputDirectory());
    LOGGER.debug("Transcoder command for {}: {}", state.id(), SourceAdapter.redactCommand(command));

    TranscoderProcess process;
    try {
      process = launcher.launch(command, state.id());
    } catch (IOException e) {
      fail(state, "Failed to spawn transcoder: " + e.getMessage(), "");
      return;
    }

    state.attach(process, clock.instant());
    structuredLogger.logStreamLaunched(
        state.id(), process.pid(), state.source().describe(), state.restartCount());

    process.exit().whenComplete((code, error) -> onExit(state, process, code, error));
    scheduler.schedule(
        () -> verifyStarted(state, process),
        clock.instant().plus(properties.startVerificationDelay()));
  }

  private void verifyStarted(StreamRuntimeState state, TranscoderProcess process) {
    synchronized (state) {
      if (state.process() != process || state.status() != StreamStatus.STARTING) {
        return;
      }
      if (process.isAlive()) {
        state.transitionTo(StreamStatus.ACTIVE);
        LOGGER.info("Stream {} is active (pid {})", state.id(), process.pid());
      }
    }
  }

  private void onExit(
      StreamRuntimeState state, TranscoderProcess process, Integer code, Throwable error) {
    synchronized (state) {
      if (state.process() != process) {
        // superseded by a restart or stop
        return;
      }
      state.detach();
      if (state.isManuallyStopped() || state.status() == StreamStatus.STOPPED) {
        return;
      }
      if (error == null && code != null && code == 0) {
        LOGGER.info("Transcoder for stream {} exited cleanly", state.id());
        state.transitionTo(StreamStatus.STOPPED);
        return;
      }
      String reason =
          error != null
              ? "Transcoder exit could not be observed: " + error.getMessage()
              : "Transcoder exited with code " + code;
      fail(state, reason, process.outputTail());
    }
  }

  /** ERROR, plus a crash restart while under the cap. Caller holds the monitor. */
  private void fail(StreamRuntimeState state, String reason, String outputTail) {
    String lastError =
        outputTail == null || outputTail.isBlank() ? reason : reason + ": " + outputTail;
    state.recordError(lastError);
    state.transitionTo(StreamStatus.ERROR);
    structuredLogger.logStreamFailed(state.id(), reason, state.restartCount(), outputTail);

    if (state.isManuallyStopped()) {
      return;
    }
    if (state.restartCount() < properties.maxRestarts()) {
      state.schedulePendingRestart(
          scheduler.schedule(
              () -> restart(state, RestartCause.CRASH),
              clock.instant().plus(properties.restartDelay())));
    } else {
      LOGGER.error(
          "Stream {} reached the restart limit ({}); leaving it to the health check",
          state.id(),
          properties.maxRestarts());
    }
  }

  /** SIGTERM, then SIGKILL after {@code grace}. Caller holds the monitor. */
  private void terminate(StreamRuntimeState state, Duration grace) {
    TranscoderProcess process = state.detach();
    if (process == null || !process.isAlive()) {
      return;
    }
    process.terminate();
    try {
      process.exit().get(grace.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      LOGGER.warn("Transcoder for stream {} ignored SIGTERM, killing it", state.id());
      process.kill();
    } catch (ExecutionException e) {
      LOGGER.debug("Transcoder for stream {} exited abnormally", state.id(), e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.kill();
    }
  }

  private void deleteOutputDirectory(Path directory) {
    if (!Files.exists(directory)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(directory)) {
      paths
          .sorted(Comparator.reverseOrder())
          .forEach(
              path -> {
                try {
                  Files.deleteIfExists(path);
                } catch (IOException e) {
                  LOGGER.warn("Failed to delete {}", path, e);
                }
              });
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up output directory {}", directory, e);
    }
  }
}
