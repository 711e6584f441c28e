package com.scholary.livefeed.detection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.livefeed.chunking.ChunkDescriptor;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the detection pipeline.
 *
 * <p>Posts the chunk location and processing metadata as JSON to {@code /api/process}; the
 * pipeline reads the chunk from shared storage and writes the annotated video and detections
 * next to each other in the processed-output directory.
 */
@Component
public class HttpDetectionClient implements DetectionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpDetectionClient.class);

  private final HttpClient httpClient;
  private final DetectionProperties properties;
  private final ObjectMapper objectMapper;
  private final Path processedOutputDir;

  @Autowired
  public HttpDetectionClient(DetectionProperties properties, ObjectMapper objectMapper) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build(),
        properties,
        objectMapper);
  }

  HttpDetectionClient(
      HttpClient httpClient, DetectionProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.processedOutputDir = Paths.get(properties.processedOutputDir()).toAbsolutePath();

    LOGGER.info("Initialized detection client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public DetectionResult process(ChunkDescriptor chunk) {
    HttpRequest request = buildRequest(chunk);
    LOGGER.debug("Sending chunk {} to {}", chunk.id(), request.uri());

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new DetectionException(
          "Detection request failed for chunk " + chunk.id() + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DetectionException("Detection request interrupted for chunk " + chunk.id(), e);
    }

    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new DetectionException(
          String.format(
              "Detection pipeline returned status %d: %s", response.statusCode(), response.body()));
    }

    try {
      DetectionResult result = objectMapper.readValue(response.body(), DetectionResult.class);
      LOGGER.debug(
          "Chunk {} processed: {} detections in {}ms",
          chunk.id(),
          result.detectionCount(),
          result.processingTimeMs());
      return result;
    } catch (JsonProcessingException e) {
      throw new DetectionException("Unparseable detection response for chunk " + chunk.id(), e);
    }
  }

  DetectionRequest toRequest(ChunkDescriptor chunk) {
    String baseName = chunk.path().getFileName().toString().replace(".mp4", "");
    return new DetectionRequest(
        chunk.path().toString(),
        chunk.streamId(),
        chunk.id(),
        chunk.startOffset(),
        new DetectionRequest.Metadata(
            chunk.duration(),
            properties.frameInterval(),
            processedOutputDir.resolve(baseName + "_processed.mp4").toString(),
            processedOutputDir.resolve(baseName + "_detections.json").toString()));
  }

  private HttpRequest buildRequest(ChunkDescriptor chunk) {
    String body;
    try {
      body = objectMapper.writeValueAsString(toRequest(chunk));
    } catch (JsonProcessingException e) {
      throw new DetectionException("Failed to serialize request for chunk " + chunk.id(), e);
    }
    return HttpRequest.newBuilder()
        .uri(URI.create(properties.baseUrl() + "/api/process"))
        .timeout(Duration.ofSeconds(properties.readTimeout()))
        .header("Content-Type", "application/json")
        .POST(BodyPublishers.ofString(body))
        .build();
  }
}
