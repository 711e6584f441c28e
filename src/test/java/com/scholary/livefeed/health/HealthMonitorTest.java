package com.scholary.livefeed.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.livefeed.source.LoopedFileSource;
import com.scholary.livefeed.source.StreamCatalog;
import com.scholary.livefeed.source.StreamDescriptor;
import com.scholary.livefeed.supervisor.ProcessSupervisor;
import com.scholary.livefeed.supervisor.RestartCause;
import com.scholary.livefeed.supervisor.StreamSnapshot;
import com.scholary.livefeed.supervisor.StreamStatus;
import com.scholary.livefeed.support.CapturingScheduler;
import com.scholary.livefeed.support.MutableClock;
import com.scholary.livefeed.support.TestProperties;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HealthMonitorTest {

  @Mock private ProcessSupervisor supervisor;
  @Mock private StreamCatalog catalog;

  @TempDir Path tempDir;

  private MutableClock clock;
  private CapturingScheduler scheduler;
  private HealthMonitor monitor;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
    scheduler = new CapturingScheduler();
    HealthProperties properties = TestProperties.health();
    monitor =
        new HealthMonitor(
            supervisor,
            catalog,
            new PlaylistInspector(clock, properties),
            properties,
            scheduler.scheduler(),
            clock);
  }

  @Test
  void schedule_shouldRunAtTheCheckInterval() {
    monitor.schedule();

    assertThat(scheduler.periodic()).hasSize(1);
    assertThat(scheduler.periodic().get(0).period()).isEqualTo(Duration.ofSeconds(30));

    monitor.cancel();

    assertThat(scheduler.periodic()).isEmpty();
  }

  @Test
  void runHealthCheck_stalePlaylist_restartsActiveStreamOnce() throws Exception {
    Path playlist = playlist("cam1", clock.instant().minusSeconds(15));
    when(supervisor.list()).thenReturn(List.of(snapshot("cam1", StreamStatus.ACTIVE, false)));
    when(supervisor.playlistPath("cam1")).thenReturn(Optional.of(playlist));

    int restarts = monitor.runHealthCheck();

    assertThat(restarts).isEqualTo(1);
    verify(supervisor, times(1)).restart("cam1", RestartCause.HEALTH);
  }

  @Test
  void runHealthCheck_freshPlaylist_leavesStreamAlone() throws Exception {
    Path playlist = playlist("cam1", clock.instant().minusSeconds(1));
    when(supervisor.list()).thenReturn(List.of(snapshot("cam1", StreamStatus.ACTIVE, false)));
    when(supervisor.playlistPath("cam1")).thenReturn(Optional.of(playlist));

    assertThat(monitor.runHealthCheck()).isZero();
    verify(supervisor, never()).restart(anyString(), any());
  }

  @Test
  void runHealthCheck_erroredStreamThatShouldRun_isRecovered() {
    when(supervisor.list()).thenReturn(List.of(snapshot("cam1", StreamStatus.ERROR, false)));
    when(catalog.find("cam1")).thenReturn(Optional.of(descriptor("cam1", true)));

    assertThat(monitor.runHealthCheck()).isEqualTo(1);
    verify(supervisor).restart("cam1", RestartCause.RECOVERY);
  }

  @Test
  void runHealthCheck_stoppedStreamNotDesired_isLeftStopped() {
    when(supervisor.list()).thenReturn(List.of(snapshot("cam1", StreamStatus.STOPPED, false)));
    when(catalog.find("cam1")).thenReturn(Optional.of(descriptor("cam1", false)));

    assertThat(monitor.runHealthCheck()).isZero();
    verify(supervisor, never()).restart(anyString(), any());
  }

  @Test
  void runHealthCheck_manuallyStoppedStream_isSkipped() {
    when(supervisor.list()).thenReturn(List.of(snapshot("cam1", StreamStatus.ERROR, true)));

    assertThat(monitor.runHealthCheck()).isZero();
    verify(supervisor, never()).restart(anyString(), any());
  }

  @Test
  void runHealthCheck_catalogFailure_skipsOnlyThatStream() {
    when(supervisor.list())
        .thenReturn(
            List.of(
                snapshot("cam1", StreamStatus.ERROR, false),
                snapshot("cam2", StreamStatus.ERROR, false)));
    when(catalog.find("cam1")).thenThrow(new IllegalStateException("store unavailable"));
    when(catalog.find("cam2")).thenReturn(Optional.of(descriptor("cam2", true)));

    assertThat(monitor.runHealthCheck()).isEqualTo(1);
    verify(supervisor, never()).restart("cam1", RestartCause.RECOVERY);
    verify(supervisor).restart("cam2", RestartCause.RECOVERY);
  }

  @Test
  void runHealthCheck_restartFailure_doesNotStopTheRound() throws Exception {
    Path first = playlist("cam1", clock.instant().minusSeconds(60));
    Path second = playlist("cam2", clock.instant().minusSeconds(60));
    when(supervisor.list())
        .thenReturn(
            List.of(
                snapshot("cam1", StreamStatus.ACTIVE, false),
                snapshot("cam2", StreamStatus.ACTIVE, false)));
    when(supervisor.playlistPath("cam1")).thenReturn(Optional.of(first));
    when(supervisor.playlistPath("cam2")).thenReturn(Optional.of(second));
    doThrow(new IllegalStateException("boom"))
        .when(supervisor)
        .restart("cam1", RestartCause.HEALTH);

    assertThat(monitor.runHealthCheck()).isEqualTo(1);
    verify(supervisor).restart("cam2", RestartCause.HEALTH);
  }

  private Path playlist(String streamId, Instant modified) throws Exception {
    Path directory = Files.createDirectories(tempDir.resolve(streamId));
    Path playlist = directory.resolve("playlist.m3u8");
    Files.writeString(playlist, "#EXTM3U\n#EXTINF:2.0,\nsegment_001.ts\n");
    Files.setLastModifiedTime(playlist, FileTime.from(modified));
    return playlist;
  }

  private StreamSnapshot snapshot(String id, StreamStatus status, boolean manuallyStopped) {
    return new StreamSnapshot(
        id,
        "Stream " + id,
        "file:" + id + ".mp4",
        status,
        null,
        clock.instant(),
        0,
        null,
        manuallyStopped,
        tempDir.resolve(id).toString(),
        "/streams/" + id + "/playlist.m3u8");
  }

  private static StreamDescriptor descriptor(String id, boolean desiredActive) {
    return new StreamDescriptor(
        id, null, new LoopedFileSource(Paths.get(id + ".mp4")), desiredActive);
  }
}
