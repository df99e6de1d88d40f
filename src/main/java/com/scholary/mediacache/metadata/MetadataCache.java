package com.scholary.mediacache.metadata;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.scholary.mediacache.connection.ObjectStoreConnectionManager;
import com.scholary.mediacache.objectstore.ObjectStoreException;
import com.scholary.mediacache.objectstore.ObjectStoreException.ErrorKind;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded cache of object metadata using Caffeine.
 *
 * <p>Entries never expire on their own. They leave the cache when capacity is reached, when {@link
 * #invalidate(String)} is called after a mutation, or when the object store connection is reset,
 * because records fetched under an expiring credential are not trusted any more.
 *
 * <p>A missing object is reported as an empty result and is never cached, so an object uploaded
 * right after a failed lookup is visible on the next one.
 *
 * <p>Misses are fetched outside of any cache lock. An invalidation that lands while a fetch is in
 * flight wins: the fetched record is returned to its caller but not stored.
 */
public class MetadataCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(MetadataCache.class);

  private final ObjectStoreConnectionManager connectionManager;
  private final Cache<String, MetadataRecord> cache;
  private final int capacity;
  private final AtomicLong invalidations = new AtomicLong();

  public MetadataCache(ObjectStoreConnectionManager connectionManager, int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Metadata cache capacity must be positive: " + capacity);
    }
    this.connectionManager = connectionManager;
    this.capacity = capacity;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(capacity)
            .executor(Runnable::run) // evict on the calling thread so size() is exact
            .recordStats()
            .build();

    connectionManager.addResetListener(this::onConnectionReset);

    LOGGER.info("Initialized metadata cache: capacity={}", capacity);
  }

  /**
   * Look up an object's metadata, fetching it from the store on a miss.
   *
   * @param objectId the object key
   * @return the metadata, or empty if the object does not exist
   * @throws com.scholary.mediacache.connection.RemoteUnavailableException if the store is
   *     unreachable or keeps rejecting the credential
   */
  public Optional<MetadataRecord> get(String objectId) {
    MetadataRecord cached = cache.getIfPresent(objectId);
    if (cached != null) {
      LOGGER.debug("Metadata cache hit: objectId={}", objectId);
      return Optional.of(cached);
    }

    LOGGER.debug("Metadata cache miss: objectId={}", objectId);
    long generation = invalidations.get();
    Optional<MetadataRecord> fetched = fetch(objectId);

    fetched.ifPresent(
        record -> {
          if (invalidations.get() == generation) {
            cache.put(objectId, record);
          } else {
            LOGGER.debug(
                "Skipped caching metadata invalidated during fetch: objectId={}", objectId);
          }
        });
    return fetched;
  }

  /** Drop one object's metadata. Must be called after any upload, delete or rename. */
  public void invalidate(String objectId) {
    invalidations.incrementAndGet();
    cache.invalidate(objectId);
    LOGGER.debug("Invalidated metadata: objectId={}", objectId);
  }

  /** Drop all metadata. */
  public void clearAll() {
    invalidations.incrementAndGet();
    cache.invalidateAll();
    LOGGER.info("Cleared metadata cache");
  }

  public MetadataCacheStats stats() {
    CacheStats stats = cache.stats();
    return new MetadataCacheStats(
        stats.hitCount(), stats.missCount(), cache.estimatedSize(), capacity);
  }

  private Optional<MetadataRecord> fetch(String objectId) {
    try {
      MetadataRecord record =
          connectionManager.withConnection(client -> client.fetchMetadata(objectId));
      return Optional.of(record);
    } catch (ObjectStoreException e) {
      if (e.getKind() == ErrorKind.NOT_FOUND) {
        LOGGER.debug("Object not found: objectId={}", objectId);
        return Optional.empty();
      }
      throw e;
    }
  }

  private void onConnectionReset() {
    LOGGER.warn("Object store connection was reset, clearing metadata cache");
    clearAll();
  }
}
