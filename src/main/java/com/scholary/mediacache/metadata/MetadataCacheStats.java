package com.scholary.mediacache.metadata;

/** Hit/miss counters and occupancy of the metadata cache. */
public record MetadataCacheStats(long hits, long misses, long size, long capacity) {

  /** Fraction of lookups answered from the cache, 0.0 when nothing was looked up yet. */
  public double hitRate() {
    long lookups = hits + misses;
    return lookups == 0 ? 0.0 : (double) hits / lookups;
  }
}
