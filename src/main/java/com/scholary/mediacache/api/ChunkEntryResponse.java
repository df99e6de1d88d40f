package com.scholary.mediacache.api;

import com.scholary.mediacache.cache.ChunkEntryView;

/** One row of the detailed chunk cache listing. */
public record ChunkEntryResponse(
    String key,
    String objectId,
    String range,
    long sizeBytes,
    long hits,
    long ageSeconds,
    long lastAccessSecondsAgo) {

  public static ChunkEntryResponse from(ChunkEntryView view) {
    return new ChunkEntryResponse(
        view.shortKey(),
        view.objectId(),
        view.start() + "-" + view.end(),
        view.sizeBytes(),
        view.hits(),
        view.ageMillis() / 1000,
        view.lastAccessMillisAgo() / 1000);
  }
}
