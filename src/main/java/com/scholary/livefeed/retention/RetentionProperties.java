package com.scholary.livefeed.retention;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for disk cleanup.
 *
 * <p>Chunk files are swept on {@code sweep-interval}; HLS segment directories are trimmed on the
 * shorter {@code segment-sweep-interval}.
 */
@ConfigurationProperties(prefix = "retention")
@Validated
public record RetentionProperties(
    @NotNull Duration chunkRetention,
    @NotNull Duration sweepInterval,
    @NotNull Duration segmentSweepInterval) {}
