package com.scholary.mediacache.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Cache for byte windows previously fetched from the object store.
 *
 * <p>An entry is identified by the exact triple (objectId, start, end). Overlapping or adjacent
 * windows are independent entries; nothing is merged or split.
 *
 * <p>Cache keys are a hash of that triple, so the key alone cannot tell which object an entry
 * belongs to. Implementations keep the object id next to each entry to support {@link
 * #invalidate(String)}.
 */
public interface ChunkCache {

  /**
   * Retrieve a cached window. A hit refreshes the entry's recency and hit count.
   *
   * @param objectId the object key
   * @param start first byte, inclusive
   * @param end last byte, inclusive
   * @return the cached bytes, or empty on a miss
   */
  Optional<byte[]> get(String objectId, long start, long end);

  /**
   * Store a window, evicting least recently used entries first if the budget requires it.
   *
   * @param objectId the object key
   * @param start first byte, inclusive
   * @param end last byte, inclusive
   * @param data the bytes of the window
   */
  default void set(String objectId, long start, long end, byte[] data) {
    set(objectId, start, end, data, generation());
  }

  /**
   * Store a window fetched while the cache was at the given generation.
   *
   * <p>The insert is dropped if any invalidation happened since {@code generation} was read, so
   * bytes fetched before an object changed never outlive the change.
   *
   * @param objectId the object key
   * @param start first byte, inclusive
   * @param end last byte, inclusive
   * @param data the bytes of the window
   * @param generation value of {@link #generation()} read before the bytes were fetched
   * @return true if the window was stored
   */
  boolean set(String objectId, long start, long end, byte[] data, long generation);

  /**
   * Invalidation counter. Advances on every {@link #invalidate(String)} and {@link #clear()}.
   */
  long generation();

  /**
   * Remove every cached window of one object.
   *
   * @param objectId the object key
   * @return number of entries removed
   */
  int invalidate(String objectId);

  /** Remove everything. */
  void clear();

  /** Summary statistics. */
  ChunkCacheStats stats();

  /**
   * The most frequently hit entries.
   *
   * @param limit maximum number of entries to return
   * @return entries ordered by hit count, highest first
   */
  List<ChunkEntryView> topEntries(int limit);

  /**
   * Generate a cache key for a window.
   *
   * @param objectId the object key
   * @param start first byte, inclusive
   * @param end last byte, inclusive
   * @return hex SHA-256 of {@code objectId:start:end}
   */
  static String generateKey(String objectId, long start, long end) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash =
          digest.digest(
              String.format("%s:%d:%d", objectId, start, end).getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
