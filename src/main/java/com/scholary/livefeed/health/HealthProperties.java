package com.scholary.livefeed.health;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for stream health checks and aggregate health thresholds. */
@ConfigurationProperties(prefix = "health")
@Validated
public record HealthProperties(
    @NotNull Duration checkInterval,
    @NotNull Duration freshnessThreshold,
    @Positive int degradedQueueDepth,
    @Positive int degradedExtractions) {}
