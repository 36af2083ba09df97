package com.scholary.chaptify.catalog;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the catalog client.
 *
 * <p>The access token is a ready bearer token; exchanging client credentials for it happens outside
 * this application. Timeouts are in seconds.
 */
@ConfigurationProperties(prefix = "catalog")
@Validated
public record CatalogProperties(
    @NotBlank String baseUrl,
    String accessToken,
    @NotBlank String market,
    @Positive int searchLimit,
    @Positive int pageSize,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxAttempts,
    @PositiveOrZero long initialBackoffMs,
    @PositiveOrZero long minRequestIntervalMs) {}
