package com.scholary.livefeed.supervisor;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcoder supervision.
 *
 * <p>Every delay here is independent: none is derived from another.
 */
@ConfigurationProperties(prefix = "supervisor")
@Validated
public record SupervisorProperties(
    @NotBlank String outputRoot,
    @NotBlank String publicPath,
    @NotBlank String mediaRoot,
    @Positive int maxStreams,
    @PositiveOrZero int maxRestarts,
    @NotNull Duration startVerificationDelay,
    @NotNull Duration restartDelay,
    @NotNull Duration restartKillWait,
    @NotNull Duration stopGracePeriod) {}
