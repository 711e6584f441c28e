package com.scholary.livefeed.api;

import com.scholary.livefeed.chunking.ChunkDescriptor;
import com.scholary.livefeed.chunking.ChunkExtractor;
import com.scholary.livefeed.chunking.ChunkScheduler;
import com.scholary.livefeed.chunking.ScheduleSnapshot;
import com.scholary.livefeed.source.SourceAdapter;
import com.scholary.livefeed.source.StreamCatalog;
import com.scholary.livefeed.source.StreamDescriptor;
import com.scholary.livefeed.supervisor.ProcessSupervisor;
import com.scholary.livefeed.supervisor.StreamNotFoundException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for chunk extraction.
 *
 * <p>Chunking is controlled separately from republishing: a stream can be analysed without being
 * served, and the other way round.
 */
@RestController
@RequestMapping("/api/processing")
@Tag(name = "Processing", description = "Periodic chunk extraction for detection")
public class ProcessingController {

  private final ChunkScheduler chunkScheduler;
  private final ChunkExtractor chunkExtractor;
  private final StreamCatalog catalog;
  private final ProcessSupervisor supervisor;
  private final SourceAdapter sourceAdapter;

  public ProcessingController(
      ChunkScheduler chunkScheduler,
      ChunkExtractor chunkExtractor,
      StreamCatalog catalog,
      ProcessSupervisor supervisor,
      SourceAdapter sourceAdapter) {
    this.chunkScheduler = chunkScheduler;
    this.chunkExtractor = chunkExtractor;
    this.catalog = catalog;
    this.supervisor = supervisor;
    this.sourceAdapter = sourceAdapter;
  }

  @GetMapping
  @Operation(summary = "List chunk schedules")
  public List<ScheduleSnapshot> list() {
    return chunkScheduler.schedules();
  }

  @PostMapping("/{id}/start")
  @Operation(
      summary = "Start chunking a stream",
      description =
          "Extract overlapping chunks periodically and queue them for detection. Without an "
              + "explicit locator the stream's local playlist is used when it is being "
              + "republished, otherwise its source.")
  public ResponseEntity<ScheduleSnapshot> start(
      @PathVariable String id,
      @Valid @RequestBody(required = false) ProcessingStartRequest request) {
    String locator = request == null ? null : request.locator();
    long seedOffset = request == null || request.seedOffset() == null ? 0L : request.seedOffset();

    if (locator == null || locator.isBlank()) {
      StreamDescriptor descriptor =
          catalog
              .find(id)
              .orElseThrow(() -> new StreamNotFoundException("Stream not configured: " + id));
      locator =
          sourceAdapter.analysisLocator(descriptor, supervisor.playlistPath(id).orElse(null));
    }

    return ResponseEntity.status(HttpStatus.CREATED)
        .body(chunkScheduler.start(id, locator, seedOffset));
  }

  @PostMapping("/{id}/stop")
  @Operation(summary = "Stop chunking a stream")
  public ResponseEntity<Void> stop(@PathVariable String id) {
    if (!chunkScheduler.stop(id)) {
      throw new StreamNotFoundException("Stream is not being processed: " + id);
    }
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/chunks/{chunkId}")
  @Operation(summary = "Locate a chunk file")
  public ResponseEntity<ChunkDescriptor> chunk(@PathVariable String chunkId) {
    return chunkExtractor
        .findChunk(chunkId)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }
}
