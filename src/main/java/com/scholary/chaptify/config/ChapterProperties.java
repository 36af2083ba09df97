package com.scholary.chaptify.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for chapter resolution and batch processing.
 *
 * <p>{@code driftTolerance} is the largest accepted relative difference between the catalog's total
 * duration and the measured file duration (0.15 = 15%).
 */
@ConfigurationProperties(prefix = "chapters")
@Validated
public record ChapterProperties(
    @Positive double driftTolerance, @Positive int batchThreads, @Positive int batchQueueSize) {}
