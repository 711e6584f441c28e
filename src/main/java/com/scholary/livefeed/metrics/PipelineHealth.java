package com.scholary.livefeed.metrics;

import java.util.List;

/** Aggregate health of the pipeline, with the reasons it is not healthy. */
public record PipelineHealth(Status status, List<String> issues, PipelineMetrics metrics) {

  public enum Status {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
  }

  public boolean isUnhealthy() {
    return status == Status.UNHEALTHY;
  }
}
