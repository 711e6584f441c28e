package com.scholary.livefeed.api;

import com.scholary.livefeed.chunking.ChunkScheduler;
import com.scholary.livefeed.health.HealthMonitor;
import com.scholary.livefeed.monitoring.KibanaUrlGenerator;
import com.scholary.livefeed.source.StreamCatalog;
import com.scholary.livefeed.source.StreamDescriptor;
import com.scholary.livefeed.supervisor.ProcessSupervisor;
import com.scholary.livefeed.supervisor.RestartCause;
import com.scholary.livefeed.supervisor.StreamNotFoundException;
import com.scholary.livefeed.supervisor.StreamSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for stream supervision.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Registering streams in the catalog
 *   <li>Starting, stopping and restarting the transcoder of a stream
 *   <li>Inspecting runtime state and playlist health
 * </ul>
 */
@RestController
@RequestMapping("/api/streams")
@Tag(name = "Streams", description = "Live stream supervision and HLS republishing")
public class StreamController {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamController.class);

  private final ProcessSupervisor supervisor;
  private final StreamCatalog catalog;
  private final HealthMonitor healthMonitor;
  private final ChunkScheduler chunkScheduler;
  private final KibanaUrlGenerator kibanaUrlGenerator;

  public StreamController(
      ProcessSupervisor supervisor,
      StreamCatalog catalog,
      HealthMonitor healthMonitor,
      ChunkScheduler chunkScheduler,
      KibanaUrlGenerator kibanaUrlGenerator) {
    this.supervisor = supervisor;
    this.catalog = catalog;
    this.healthMonitor = healthMonitor;
    this.chunkScheduler = chunkScheduler;
    this.kibanaUrlGenerator = kibanaUrlGenerator;
  }

  @GetMapping
  @Operation(summary = "List supervised streams", description = "Runtime state of every stream")
  public List<StreamSnapshot> list() {
    return supervisor.list();
  }

  @GetMapping("/catalog")
  @Operation(summary = "List configured streams")
  public List<CatalogEntryResponse> catalog() {
    return catalog.findAll().stream()
        .map(CatalogEntryResponse::from)
        .collect(Collectors.toList());
  }

  @PutMapping("/{id}")
  @Operation(
      summary = "Register a stream",
      description = "Insert or replace a stream in the catalog. Does not start or stop it.")
  public CatalogEntryResponse register(
      @PathVariable String id, @Valid @RequestBody StreamRequest request) {
    StreamDescriptor descriptor = catalog.save(request.toDescriptor(id));
    LOGGER.info("Registered stream {} ({})", id, descriptor.source().describe());
    return CatalogEntryResponse.from(descriptor);
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get stream state", description = "Runtime state and playlist health")
  public StreamDetailResponse get(@PathVariable String id) {
    StreamSnapshot snapshot =
        supervisor
            .snapshot(id)
            .orElseThrow(() -> new StreamNotFoundException("Stream not running: " + id));
    return new StreamDetailResponse(
        snapshot,
        healthMonitor.inspect(id).orElse(null),
        kibanaUrlGenerator.generateStreamUrl(id));
  }

  @PostMapping("/{id}/start")
  @Operation(
      summary = "Start a stream",
      description = "Mark the stream as desired active and launch its transcoder")
  public ResponseEntity<StreamSnapshot> start(@PathVariable String id) {
    StreamDescriptor descriptor =
        catalog
            .setDesiredActive(id, true)
            .orElseThrow(() -> new StreamNotFoundException("Stream not configured: " + id));
    return ResponseEntity.status(HttpStatus.CREATED).body(supervisor.start(descriptor));
  }

  @PostMapping("/{id}/stop")
  @Operation(
      summary = "Stop a stream",
      description =
          "Clear desired active, cancel chunking, terminate the transcoder and delete its output")
  public StreamSnapshot stop(@PathVariable String id) {
    catalog.setDesiredActive(id, false);
    // the schedule reads the playlist that stop deletes
    if (chunkScheduler.stop(id)) {
      LOGGER.info("Cancelled chunking of stream {} before stopping it", id);
    }
    return supervisor.stop(id);
  }

  @PostMapping("/{id}/restart")
  @Operation(
      summary = "Restart a stream",
      description = "Operator restart: clears the manual stop flag and the restart counter")
  public StreamSnapshot restart(@PathVariable String id) {
    if (supervisor.snapshot(id).isEmpty()) {
      return start(id).getBody();
    }
    catalog.setDesiredActive(id, true);
    supervisor.restart(id, RestartCause.OPERATOR);
    return supervisor
        .snapshot(id)
        .orElseThrow(() -> new StreamNotFoundException("Stream not running: " + id));
  }
}
