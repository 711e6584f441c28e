package com.scholary.livefeed.process;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg invocations.
 *
 * <p>The HLS values (segment duration, playlist size) are passed through to the transcoder
 * unchanged; the playback feed depends on them being honored exactly.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String binary,
    @Positive int segmentDuration,
    @Positive int playlistSize,
    @NotBlank String bitrate,
    @NotBlank String preset,
    @PositiveOrZero int crf,
    @NotBlank String audioBitrate,
    @NotNull Duration rtspTimeout) {}
