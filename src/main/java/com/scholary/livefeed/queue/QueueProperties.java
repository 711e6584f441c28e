package com.scholary.livefeed.queue;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the processing queue.
 *
 * <p>{@code maxSize} bounds unfinished jobs: waiting, delayed and processing. A job in flight
 * keeps its slot, so a failed attempt can always go back to waiting.
 */
@ConfigurationProperties(prefix = "queue")
@Validated
public record QueueProperties(
    @Positive int concurrency,
    @Positive int maxSize,
    @Positive int maxAttempts,
    @NotNull Duration backoff,
    @Positive int historySize,
    @NotNull Duration historyTtl) {}
