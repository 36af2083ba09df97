package com.scholary.chaptify.remux;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the ffmpeg and ffprobe invocations.
 *
 * <p>{@code durationToleranceMs} bounds how far the remuxed file's duration may stray from the
 * source's before the output is rejected.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @Positive int remuxTimeoutSeconds,
    @Positive int probeTimeoutSeconds,
    @PositiveOrZero long durationToleranceMs) {}
