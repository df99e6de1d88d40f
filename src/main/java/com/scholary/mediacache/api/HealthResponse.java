package com.scholary.mediacache.api;

/**
 * Full health report.
 *
 * <p>{@code status} is {@code healthy} when the object store answered the probe, otherwise {@code
 * degraded}. The caches keep serving cached windows while degraded.
 */
public record HealthResponse(
    String status,
    boolean objectStoreReachable,
    ConnectionResponse connection,
    MetadataCacheStatsResponse metadataCache,
    ChunkCacheStatsResponse chunkCache) {}
