package com.scholary.livefeed.api;

import com.scholary.livefeed.health.StreamHealth;
import com.scholary.livefeed.supervisor.StreamSnapshot;

/** Runtime state of one stream with its playlist health and a link to its logs. */
public record StreamDetailResponse(StreamSnapshot stream, StreamHealth health, String kibanaUrl) {}
