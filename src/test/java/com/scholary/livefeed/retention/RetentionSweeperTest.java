package com.scholary.livefeed.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.scholary.livefeed.chunking.ChunkExtractor;
import com.scholary.livefeed.supervisor.ProcessSupervisor;
import com.scholary.livefeed.supervisor.StreamSnapshot;
import com.scholary.livefeed.supervisor.StreamStatus;
import com.scholary.livefeed.support.CapturingScheduler;
import com.scholary.livefeed.support.MutableClock;
import com.scholary.livefeed.support.TestProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetentionSweeperTest {

  @Mock private ChunkExtractor extractor;
  @Mock private ProcessSupervisor supervisor;

  @TempDir Path tempDir;

  private MutableClock clock;
  private CapturingScheduler scheduler;
  private RetentionSweeper sweeper;
  private Path chunkDir;
  private Path processedDir;

  @BeforeEach
  void setUp() throws IOException {
    clock = new MutableClock(Instant.parse("2024-05-02T12:00:00Z"));
    scheduler = new CapturingScheduler();
    chunkDir = Files.createDirectories(tempDir.resolve("chunks"));
    processedDir = Files.createDirectories(tempDir.resolve("processed"));
    when(extractor.outputDir()).thenReturn(chunkDir);
    sweeper =
        new RetentionSweeper(
            extractor,
            TestProperties.detection(tempDir, "http://detector:8000"),
            supervisor,
            TestProperties.ffmpeg(),
            TestProperties.retention(),
            scheduler.scheduler(),
            clock);
  }

  @Test
  void schedule_registersSweepAndSegmentTrim() {
    sweeper.schedule();

    assertThat(scheduler.periodic())
        .extracting(CapturingScheduler.Task::period)
        .containsExactlyInAnyOrder(Duration.ofHours(1), Duration.ofMinutes(1));

    sweeper.cancel();

    assertThat(scheduler.periodic()).isEmpty();
  }

  @Test
  void sweep_deletesExpiredChunksAndProcessedOutput() throws IOException {
    Instant expired = clock.instant().minus(Duration.ofHours(25));
    Instant fresh = clock.instant().minus(Duration.ofHours(1));
    file(chunkDir.resolve("cam1_old.mp4"), 100, expired);
    file(chunkDir.resolve("cam1_new.mp4"), 100, fresh);
    file(chunkDir.resolve("notes.txt"), 10, expired);
    file(processedDir.resolve("cam1_old_processed.mp4"), 300, expired);
    file(processedDir.resolve("cam1_old_detections.json"), 20, expired);
    file(processedDir.resolve("cam1_new_detections.json"), 20, fresh);

    SweepReport report = sweeper.sweep();

    assertThat(report.chunksDeleted()).isEqualTo(1);
    assertThat(report.processedDeleted()).isEqualTo(2);
    assertThat(report.segmentsDeleted()).isZero();
    assertThat(report.bytesFreed()).isEqualTo(420);
    assertThat(report.at()).isEqualTo(clock.instant());
    assertThat(names(chunkDir)).containsExactlyInAnyOrder("cam1_new.mp4", "notes.txt");
    assertThat(names(processedDir)).containsExactly("cam1_new_detections.json");
  }

  @Test
  void sweep_missingDirectories_deletesNothing() throws IOException {
    Files.delete(chunkDir);
    Files.delete(processedDir);

    assertThat(sweeper.sweep().filesDeleted()).isZero();
  }

  @Test
  void trimSegments_keepsNewestPlaylistWindowOnceBacklogDoubles() throws IOException {
    Path streamDir = Files.createDirectories(tempDir.resolve("streams").resolve("cam1"));
    Instant base = clock.instant().minusSeconds(60);
    for (int i = 0; i < 13; i++) {
      file(streamDir.resolve(String.format("segment_%03d.ts", i)), 10, base.plusSeconds(i * 2L));
    }
    file(streamDir.resolve("playlist.m3u8"), 10, base);
    when(supervisor.list()).thenReturn(List.of(stream("cam1", StreamStatus.ACTIVE, streamDir)));

    assertThat(sweeper.trimSegments()).isEqualTo(7);

    assertThat(names(streamDir))
        .containsExactlyInAnyOrder(
            "segment_007.ts",
            "segment_008.ts",
            "segment_009.ts",
            "segment_010.ts",
            "segment_011.ts",
            "segment_012.ts",
            "playlist.m3u8");
  }

  @Test
  void trimSegments_leavesSmallBacklogAlone() throws IOException {
    Path streamDir = Files.createDirectories(tempDir.resolve("streams").resolve("cam1"));
    for (int i = 0; i < 12; i++) {
      file(streamDir.resolve(String.format("segment_%03d.ts", i)), 10, clock.instant());
    }
    when(supervisor.list()).thenReturn(List.of(stream("cam1", StreamStatus.ACTIVE, streamDir)));

    assertThat(sweeper.trimSegments()).isZero();
  }

  @Test
  void trimSegments_skipsStreamsThatAreNotActive() throws IOException {
    Path streamDir = Files.createDirectories(tempDir.resolve("streams").resolve("cam1"));
    for (int i = 0; i < 20; i++) {
      file(streamDir.resolve(String.format("segment_%03d.ts", i)), 10, clock.instant());
    }
    when(supervisor.list()).thenReturn(List.of(stream("cam1", StreamStatus.ERROR, streamDir)));

    assertThat(sweeper.trimSegments()).isZero();
    assertThat(names(streamDir)).hasSize(20);
  }

  private static void file(Path path, int bytes, Instant modified) throws IOException {
    Files.write(path, new byte[bytes]);
    Files.setLastModifiedTime(path, FileTime.from(modified));
  }

  private static List<String> names(Path directory) throws IOException {
    try (Stream<Path> files = Files.list(directory)) {
      return files.map(path -> path.getFileName().toString()).collect(Collectors.toList());
    }
  }

  private StreamSnapshot stream(String id, StreamStatus status, Path directory) {
    return new StreamSnapshot(
        id,
        "Camera",
        "file:/media/race.mp4",
        status,
        null,
        clock.instant(),
        0,
        null,
        false,
        directory.toString(),
        "/streams/" + id + "/playlist.m3u8");
  }
}
