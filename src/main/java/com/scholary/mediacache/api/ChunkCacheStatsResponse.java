package com.scholary.mediacache.api;

import com.scholary.mediacache.cache.ChunkCacheStats;

/** Summary of the chunk cache. */
public record ChunkCacheStatsResponse(
    int items,
    long bytesUsed,
    double sizeMb,
    long budgetBytes,
    double utilizationPercent,
    long hits,
    long misses,
    double hitRate,
    String cacheDir) {

  private static final double MB = 1024.0 * 1024.0;

  public static ChunkCacheStatsResponse from(ChunkCacheStats stats) {
    return new ChunkCacheStatsResponse(
        stats.items(),
        stats.bytesUsed(),
        round(stats.bytesUsed() / MB),
        stats.budgetBytes(),
        round(stats.utilizationPercent()),
        stats.hits(),
        stats.misses(),
        round(stats.hitRate()),
        stats.cacheDir());
  }

  private static double round(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
