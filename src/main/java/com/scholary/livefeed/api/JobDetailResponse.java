package com.scholary.livefeed.api;

import com.scholary.livefeed.queue.JobSnapshot;

/** A processing job with a link to its logs in Kibana. */
public record JobDetailResponse(JobSnapshot job, String kibanaUrl) {}
