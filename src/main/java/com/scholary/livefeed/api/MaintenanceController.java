package com.scholary.livefeed.api;

import com.scholary.livefeed.retention.RetentionSweeper;
import com.scholary.livefeed.retention.SweepReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/maintenance")
@Tag(name = "Maintenance", description = "Out-of-band housekeeping")
public class MaintenanceController {

  private final RetentionSweeper retentionSweeper;

  public MaintenanceController(RetentionSweeper retentionSweeper) {
    this.retentionSweeper = retentionSweeper;
  }

  @PostMapping("/sweep")
  @Operation(
      summary = "Run a retention sweep now",
      description = "Delete expired chunks and processed output, and trim segment directories")
  public SweepReport sweep() {
    return retentionSweeper.sweep();
  }
}
