package com.scholary.mediacache.cache;

/** Summary of chunk cache occupancy and effectiveness. */
public record ChunkCacheStats(
    int items, long bytesUsed, long budgetBytes, long hits, long misses, String cacheDir) {

  /** Used bytes as a percentage of the budget. */
  public double utilizationPercent() {
    return budgetBytes == 0 ? 0.0 : (double) bytesUsed / budgetBytes * 100;
  }

  /** Fraction of lookups that were hits, 0.0 when nothing was looked up yet. */
  public double hitRate() {
    long lookups = hits + misses;
    return lookups == 0 ? 0.0 : (double) hits / lookups;
  }
}
