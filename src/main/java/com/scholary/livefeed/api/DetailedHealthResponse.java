package com.scholary.livefeed.api;

import com.scholary.livefeed.chunking.ScheduleSnapshot;
import com.scholary.livefeed.metrics.PipelineHealth;
import com.scholary.livefeed.queue.QueueStatus;
import java.util.List;
import java.util.Map;

/** Aggregate health plus everything an operator needs to explain it. */
public record DetailedHealthResponse(
    PipelineHealth health,
    QueueStatus queue,
    List<StreamDetailResponse> streams,
    List<ScheduleSnapshot> schedules,
    Map<String, Object> configuration) {}
