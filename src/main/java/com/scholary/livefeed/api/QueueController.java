package com.scholary.livefeed.api;

import com.scholary.livefeed.monitoring.KibanaUrlGenerator;
import com.scholary.livefeed.queue.JobSnapshot;
import com.scholary.livefeed.queue.ProcessingQueue;
import com.scholary.livefeed.queue.QueueStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Read-only view of the processing queue. */
@RestController
@RequestMapping("/api/queue")
@Validated
@Tag(name = "Queue", description = "Processing queue status and job history")
public class QueueController {

  private final ProcessingQueue queue;
  private final KibanaUrlGenerator kibanaUrlGenerator;

  public QueueController(ProcessingQueue queue, KibanaUrlGenerator kibanaUrlGenerator) {
    this.queue = queue;
    this.kibanaUrlGenerator = kibanaUrlGenerator;
  }

  @GetMapping
  @Operation(summary = "Queue status", description = "Waiting, delayed, processing and totals")
  public QueueStatus status() {
    return queue.status();
  }

  @GetMapping("/jobs")
  @Operation(summary = "Recent jobs, newest first")
  public List<JobSnapshot> jobs(
      @RequestParam(defaultValue = "50") @Min(1) @Max(1000) int limit) {
    return queue.recentJobs(limit);
  }

  @GetMapping("/jobs/{jobId}")
  @Operation(summary = "Job detail", description = "Job state with a Kibana link to its logs")
  public ResponseEntity<JobDetailResponse> job(@PathVariable String jobId) {
    return queue
        .job(jobId)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobDetailResponse(job, kibanaUrlGenerator.generateJobUrl(jobId))))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @GetMapping("/failed")
  @Operation(
      summary = "Failed jobs",
      description = "Jobs that exhausted their attempts or were evicted")
  public List<JobSnapshot> failed() {
    return queue.recentFailures();
  }
}
