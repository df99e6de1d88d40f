package com.scholary.mediacache.cache;

import java.time.Instant;

/** Read-only snapshot of a cache entry, used for detailed stats. */
public record ChunkEntryView(
    String key,
    String objectId,
    long start,
    long end,
    long sizeBytes,
    long hits,
    Instant createdAt,
    Instant lastAccessAt,
    long ageMillis,
    long lastAccessMillisAgo) {

  /** First 16 hex characters of the key, enough to tell entries apart in a listing. */
  public String shortKey() {
    return key.length() > 16 ? key.substring(0, 16) : key;
  }
}
