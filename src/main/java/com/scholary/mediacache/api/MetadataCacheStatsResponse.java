package com.scholary.mediacache.api;

import com.scholary.mediacache.metadata.MetadataCacheStats;

/** Counters of the metadata cache. */
public record MetadataCacheStatsResponse(
    long hits, long misses, long size, long capacity, double hitRate) {

  public static MetadataCacheStatsResponse from(MetadataCacheStats stats) {
    return new MetadataCacheStatsResponse(
        stats.hits(),
        stats.misses(),
        stats.size(),
        stats.capacity(),
        Math.round(stats.hitRate() * 10000.0) / 10000.0);
  }
}
