package com.scholary.livefeed.supervisor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.livefeed.process.FfmpegProperties;
import com.scholary.livefeed.source.LoopedFileSource;
import com.scholary.livefeed.source.SourceAdapter;
import com.scholary.livefeed.source.StreamDescriptor;
import com.scholary.livefeed.support.CapturingScheduler;
import com.scholary.livefeed.support.FakeTranscoderLauncher;
import com.scholary.livefeed.support.FakeTranscoderProcess;
import com.scholary.livefeed.support.MutableClock;
import com.scholary.livefeed.support.TestProperties;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProcessSupervisorTest {

  @TempDir Path tempDir;

  private FakeTranscoderLauncher launcher;
  private CapturingScheduler scheduler;
  private MutableClock clock;
  private ProcessSupervisor supervisor;

  @BeforeEach
  void setUp() throws Exception {
    Files.createDirectories(tempDir.resolve("media"));
    Files.write(tempDir.resolve("media").resolve("race.mp4"), new byte[] {1, 2, 3});
    launcher = new FakeTranscoderLauncher();
    scheduler = new CapturingScheduler();
    clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
    supervisor = newSupervisor(10, 3);
  }

  @Test
  void start_shouldLaunchHlsTranscoderAndBecomeActiveAfterVerification() {
    StreamSnapshot started = supervisor.start(descriptor("cam1"));

    assertThat(started.status()).isEqualTo(StreamStatus.STARTING);
    assertThat(started.playlistUrl()).isEqualTo("/streams/cam1/playlist.m3u8");
    assertThat(Files.isDirectory(Paths.get(started.outputDirectory()))).isTrue();

    List<String> command = launcher.commands().get(0);
    assertThat(command).startsWith("ffmpeg", "-re", "-stream_loop", "-1", "-i");
    assertThat(command)
        .containsSubsequence("-f", "hls", "-hls_time", "2", "-hls_list_size", "6")
        .containsSubsequence("-hls_flags", "delete_segments");
    assertThat(command.get(command.size() - 1)).endsWith("playlist.m3u8");

    scheduler.runDue();

    assertThat(supervisor.snapshot("cam1").get().status()).isEqualTo(StreamStatus.ACTIVE);
  }

  @Test
  void start_shouldRejectStreamThatIsAlreadySupervised() {
    supervisor.start(descriptor("cam1"));

    assertThatThrownBy(() -> supervisor.start(descriptor("cam1")))
        .isInstanceOf(StreamAlreadyExistsException.class);
    assertThat(launcher.launchCount()).isEqualTo(1);
  }

  @Test
  void start_shouldRejectStreamsBeyondCapacity() {
    supervisor = newSupervisor(1, 3);
    supervisor.start(descriptor("cam1"));

    assertThatThrownBy(() -> supervisor.start(descriptor("cam2")))
        .isInstanceOf(StreamCapacityException.class);
  }

  @Test
  void start_shouldLaunchOneTranscoderUnderConcurrentStarts() throws Exception {
    int threads = 8;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch ready = new CountDownLatch(1);
    List<Future<Boolean>> results = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        results.add(
            executor.submit(
                () -> {
                  ready.await();
                  try {
                    supervisor.start(descriptor("cam1"));
                    return true;
                  } catch (StreamAlreadyExistsException e) {
                    return false;
                  }
                }));
      }
      ready.countDown();

      int started = 0;
      for (Future<Boolean> result : results) {
        if (result.get(5, TimeUnit.SECONDS)) {
          started++;
        }
      }
      assertThat(started).isEqualTo(1);
      assertThat(launcher.launchCount()).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void crash_shouldRestartUntilTheCapIsReached() {
    supervisor.start(descriptor("cam1"));
    scheduler.runDue();

    for (int i = 0; i < 4; i++) {
      launcher.lastProcess().finish(1);
      scheduler.runDue();
      assertThat(supervisor.snapshot("cam1").get().restartCount()).isLessThanOrEqualTo(3);
    }

    StreamSnapshot snapshot = supervisor.snapshot("cam1").get();
    assertThat(launcher.launchCount()).isEqualTo(4);
    assertThat(snapshot.restartCount()).isEqualTo(3);
    assertThat(snapshot.status()).isEqualTo(StreamStatus.ERROR);
    assertThat(snapshot.lastError()).contains("exited with code 1");
    assertThat(scheduler.pending()).isEmpty();
  }

  @Test
  void cleanExit_shouldStopWithoutCrashRestart() {
    supervisor.start(descriptor("cam1"));
    scheduler.runDue();

    launcher.lastProcess().finish(0);
    scheduler.runDue();

    assertThat(supervisor.snapshot("cam1").get().status()).isEqualTo(StreamStatus.STOPPED);
    assertThat(launcher.launchCount()).isEqualTo(1);
  }

  @Test
  void spawnFailure_shouldSurfaceAsErrorStateInsteadOfThrowing() {
    launcher.failingWith("ffmpeg: not found");

    StreamSnapshot snapshot = supervisor.start(descriptor("cam1"));

    assertThat(snapshot.status()).isEqualTo(StreamStatus.ERROR);
    assertThat(snapshot.lastError()).contains("ffmpeg: not found");

    scheduler.runDue();

    assertThat(launcher.launchCount()).isEqualTo(4);
    assertThat(supervisor.snapshot("cam1").get().restartCount()).isEqualTo(3);
  }

  @Test
  void stop_shouldTerminateDeleteOutputAndUnregister() {
    StreamSnapshot started = supervisor.start(descriptor("cam1"));
    scheduler.runDue();
    FakeTranscoderProcess process = launcher.lastProcess();

    StreamSnapshot stopped = supervisor.stop("cam1");

    assertThat(stopped.status()).isEqualTo(StreamStatus.STOPPED);
    assertThat(stopped.manuallyStopped()).isTrue();
    assertThat(process.wasTerminated()).isTrue();
    assertThat(process.wasKilled()).isFalse();
    assertThat(Files.exists(Paths.get(started.outputDirectory()))).isFalse();
    assertThat(supervisor.snapshot("cam1")).isEmpty();
  }

  @Test
  void stop_shouldKillTranscoderThatIgnoresSigterm() {
    launcher.producing(command -> new FakeTranscoderProcess().ignoringTerminate());
    supervisor.start(descriptor("cam1"));

    supervisor.stop("cam1");

    assertThat(launcher.lastProcess().wasKilled()).isTrue();
  }

  @Test
  void stop_shouldCancelPendingCrashRestart() {
    supervisor.start(descriptor("cam1"));
    scheduler.runDue();
    launcher.lastProcess().finish(1);

    supervisor.stop("cam1");
    scheduler.runDue();
    for (CapturingScheduler.Task task : scheduler.all()) {
      task.run();
    }

    assertThat(launcher.launchCount()).isEqualTo(1);
    assertThat(supervisor.snapshot("cam1")).isEmpty();
    assertThatThrownBy(() -> supervisor.restart("cam1", RestartCause.HEALTH))
        .isInstanceOf(StreamNotFoundException.class);
  }

  @Test
  void operatorRestart_shouldResetCounterAndRelaunch() {
    supervisor.start(descriptor("cam1"));
    scheduler.runDue();
    for (int i = 0; i < 4; i++) {
      launcher.lastProcess().finish(1);
      scheduler.runDue();
    }
    assertThat(supervisor.snapshot("cam1").get().restartCount()).isEqualTo(3);

    supervisor.restart("cam1", RestartCause.OPERATOR);
    scheduler.runDue();

    StreamSnapshot snapshot = supervisor.snapshot("cam1").get();
    assertThat(snapshot.restartCount()).isZero();
    assertThat(snapshot.status()).isEqualTo(StreamStatus.ACTIVE);
  }

  @Test
  void recoveryRestart_shouldResetCounter() {
    supervisor.start(descriptor("cam1"));
    scheduler.runDue();
    launcher.lastProcess().finish(1);
    scheduler.runDue();
    assertThat(supervisor.snapshot("cam1").get().restartCount()).isEqualTo(1);

    supervisor.restart("cam1", RestartCause.RECOVERY);

    assertThat(supervisor.snapshot("cam1").get().restartCount()).isZero();
  }

  @Test
  void healthRestart_shouldKeepCounterAndIgnoreExitOfReplacedProcess() {
    supervisor.start(descriptor("cam1"));
    scheduler.runDue();
    launcher.lastProcess().finish(1);
    scheduler.runDue();
    FakeTranscoderProcess stuck = launcher.lastProcess();

    supervisor.restart("cam1", RestartCause.HEALTH);

    assertThat(stuck.wasTerminated()).isTrue();
    StreamSnapshot snapshot = supervisor.snapshot("cam1").get();
    assertThat(snapshot.status()).isEqualTo(StreamStatus.STARTING);
    assertThat(snapshot.restartCount()).isEqualTo(1);

    scheduler.runDue();

    assertThat(supervisor.snapshot("cam1").get().status()).isEqualTo(StreamStatus.ACTIVE);
    assertThat(launcher.launchCount()).isEqualTo(3);
  }

  @Test
  void shutdown_shouldStopEveryStream() {
    supervisor.start(descriptor("cam1"));
    supervisor.start(descriptor("cam2"));

    supervisor.shutdown();

    assertThat(supervisor.list()).isEmpty();
    assertThat(launcher.processes()).allMatch(FakeTranscoderProcess::wasTerminated);
  }

  private ProcessSupervisor newSupervisor(int maxStreams, int maxRestarts) {
    SupervisorProperties properties = TestProperties.supervisor(tempDir, maxStreams, maxRestarts);
    FfmpegProperties ffmpeg = TestProperties.ffmpeg();
    return new ProcessSupervisor(
        new StreamRegistry(),
        launcher,
        new SourceAdapter(properties, ffmpeg),
        new HlsCommandBuilder(ffmpeg),
        properties,
        scheduler.scheduler(),
        clock);
  }

  private static StreamDescriptor descriptor(String id) {
    return new StreamDescriptor(id, null, new LoopedFileSource(Paths.get("race.mp4")), true);
  }
}
