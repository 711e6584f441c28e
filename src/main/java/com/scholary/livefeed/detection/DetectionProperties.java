package com.scholary.livefeed.detection;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the detection pipeline client.
 *
 * <p>Timeouts are in seconds. Retries are not configured here: the processing queue owns them.
 */
@ConfigurationProperties(prefix = "detection")
@Validated
public record DetectionProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int frameInterval,
    @NotBlank String processedOutputDir) {}
