package com.scholary.mediacache.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the caches and the streaming paths.
 *
 * <p>All sizes are in bytes. Defaults live in application.yml.
 */
@ConfigurationProperties(prefix = "mediacache")
@Validated
public record MediaCacheProperties(
    @NotBlank String chunkCacheDir,
    @Positive long chunkCacheBudgetBytes,
    @Positive int metadataCacheCapacity,
    @Positive long maxUnboundedRangeBytes,
    @Positive long maxRangeChunkBytes,
    @Positive long fullBufferThresholdBytes,
    @Positive int streamingChunkBytes,
    @NotBlank String defaultContentType,
    @NotBlank String cacheControl,
    @Positive int topEntries) {}
