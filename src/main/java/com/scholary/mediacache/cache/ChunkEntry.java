package com.scholary.mediacache.cache;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Index entry for one cached window. Access fields are guarded by the owning cache's lock.
 */
final class ChunkEntry {

  private final String key;
  private final String objectId;
  private final long start;
  private final long end;
  private final long sizeBytes;
  private final Path storagePath;
  private final Path sidecarPath;
  private final Instant createdAt;

  private Instant lastAccessAt;
  private long hitCount;

  ChunkEntry(
      String key,
      String objectId,
      long start,
      long end,
      long sizeBytes,
      Path storagePath,
      Path sidecarPath,
      Instant createdAt,
      Instant lastAccessAt) {
    this.key = key;
    this.objectId = objectId;
    this.start = start;
    this.end = end;
    this.sizeBytes = sizeBytes;
    this.storagePath = storagePath;
    this.sidecarPath = sidecarPath;
    this.createdAt = createdAt;
    this.lastAccessAt = lastAccessAt;
  }

  void recordHit(Instant now) {
    lastAccessAt = now;
    hitCount++;
  }

  ChunkEntryView toView(Instant now) {
    return new ChunkEntryView(
        key,
        objectId,
        start,
        end,
        sizeBytes,
        hitCount,
        createdAt,
        lastAccessAt,
        now.toEpochMilli() - createdAt.toEpochMilli(),
        now.toEpochMilli() - lastAccessAt.toEpochMilli());
  }

  String key() {
    return key;
  }

  String objectId() {
    return objectId;
  }

  long start() {
    return start;
  }

  long end() {
    return end;
  }

  long sizeBytes() {
    return sizeBytes;
  }

  Path storagePath() {
    return storagePath;
  }

  Path sidecarPath() {
    return sidecarPath;
  }

  Instant lastAccessAt() {
    return lastAccessAt;
  }

  long hitCount() {
    return hitCount;
  }
}
