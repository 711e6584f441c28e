package com.scholary.livefeed.detection;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of a processing request to the detection pipeline. */
public record DetectionRequest(
    @JsonProperty("chunk_path") String chunkPath,
    @JsonProperty("stream_id") String streamId,
    @JsonProperty("chunk_id") String chunkId,
    @JsonProperty("start_time") double startTime,
    Metadata metadata) {

  public record Metadata(
      int duration,
      @JsonProperty("frame_interval") int frameInterval,
      @JsonProperty("output_video_path") String outputVideoPath,
      @JsonProperty("output_json_path") String outputJsonPath) {}
}
