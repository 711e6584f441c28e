package com.scholary.livefeed.detection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Response of the detection pipeline for one chunk.
 *
 * <p>Detections, overlay data and model info are passed through untouched; this service does
 * not interpret them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DetectionResult(
    @JsonProperty("chunk_id") String chunkId,
    @JsonProperty("stream_id") String streamId,
    String status,
    @JsonProperty("processing_time_ms") long processingTimeMs,
    List<Map<String, Object>> detections,
    @JsonProperty("overlay_data") Map<String, Object> overlayData,
    @JsonProperty("model_info") Map<String, Object> modelInfo) {

  public int detectionCount() {
    return detections == null ? 0 : detections.size();
  }
}
