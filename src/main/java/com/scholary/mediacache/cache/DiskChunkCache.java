package com.scholary.mediacache.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.mediacache.logging.StructuredLogger;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Disk-backed implementation of ChunkCache.
 *
 * <p>Each window is one {@code <key>.chunk} file plus a {@code <key>.meta} JSON sidecar in the
 * cache directory. The directory belongs to this cache alone. An in-memory index, kept in
 * least-recently-used order, tracks size, timestamps and hit counts.
 *
 * <p>Eviction: when an insert would push the total over the budget, entries are evicted from the
 * least recently accessed end until usage is at most {@code min(80% of budget, budget - incoming)}.
 * Evicting to 80% rather than to "just enough" keeps a burst of inserts from paying for an
 * eviction pass each.
 *
 * <p>Concurrency: index mutations happen under one lock. File contents are written to a temp file
 * and read back outside the lock; only renames and deletes run while holding it. There is no
 * single-flight deduplication, so two concurrent misses for the same window both fetch and the
 * second insert replaces the first. An insert carries the invalidation generation read before its
 * bytes were fetched and is dropped if {@link #invalidate(String)} or {@link #clear()} ran since.
 *
 * <p>The cache repairs itself: an entry whose file was deleted or damaged behind its back is
 * dropped and reported as a miss.
 */
public class DiskChunkCache implements ChunkCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(DiskChunkCache.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final double EVICTION_TARGET_RATIO = 0.8;
  static final String CHUNK_SUFFIX = ".chunk";
  static final String SIDECAR_SUFFIX = ".meta";
  private static final String TEMP_SUFFIX = ".tmp";

  private final Path cacheDir;
  private final long budgetBytes;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  // access-ordered: iteration starts at the least recently used entry
  private final LinkedHashMap<String, ChunkEntry> index = new LinkedHashMap<>(64, 0.75f, true);
  private final Map<String, Set<String>> keysByObject = new HashMap<>();
  private long bytesUsed;
  // advanced by invalidate and clear, compared under the lock by set
  private final AtomicLong invalidations = new AtomicLong();

  private final LongAdder hits = new LongAdder();
  private final LongAdder misses = new LongAdder();

  public DiskChunkCache(Path cacheDir, long budgetBytes, ObjectMapper objectMapper) {
    this(cacheDir, budgetBytes, objectMapper, Clock.systemUTC());
  }

  DiskChunkCache(Path cacheDir, long budgetBytes, ObjectMapper objectMapper, Clock clock) {
    if (budgetBytes <= 0) {
      throw new IllegalArgumentException("Chunk cache budget must be positive: " + budgetBytes);
    }
    this.cacheDir = cacheDir;
    this.budgetBytes = budgetBytes;
    this.objectMapper = objectMapper;
    this.clock = clock;

    try {
      Files.createDirectories(cacheDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create cache directory: " + cacheDir, e);
    }

    loadExistingEntries();

    LOGGER.info(
        "Initialized chunk cache: dir={}, budget={} bytes, entries={}, used={} bytes",
        cacheDir,
        budgetBytes,
        index.size(),
        bytesUsed);
  }

  @Override
  public Optional<byte[]> get(String objectId, long start, long end) {
    String key = ChunkCache.generateKey(objectId, start, end);

    ChunkEntry entry;
    long hitCount;
    lock.lock();
    try {
      entry = index.get(key); // moves the entry to the most recently used position
      if (entry == null) {
        misses.increment();
        structuredLogger.logCacheMiss(objectId, start, end);
        return Optional.empty();
      }
      entry.recordHit(clock.instant());
      hitCount = entry.hitCount();
    } finally {
      lock.unlock();
    }

    // Read outside the lock so disk reads don't block other index operations
    try {
      byte[] data = Files.readAllBytes(entry.storagePath());
      if (data.length != entry.sizeBytes()) {
        heal(entry, "size on disk " + data.length + " != indexed " + entry.sizeBytes());
        return Optional.empty();
      }
      hits.increment();
      structuredLogger.logCacheHit(key, objectId, start, end, data.length, hitCount);
      return Optional.of(data);

    } catch (NoSuchFileException e) {
      heal(entry, "backing file missing");
      return Optional.empty();

    } catch (IOException e) {
      heal(entry, "read failed: " + e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public long generation() {
    return invalidations.get();
  }

  @Override
  public boolean set(String objectId, long start, long end, byte[] data, long generation) {
    String key = ChunkCache.generateKey(objectId, start, end);
    long size = data.length;

    if (size > budgetBytes) {
      LOGGER.info(
          "Not caching window larger than the whole budget: objectId={}, range={}-{}, size={}",
          objectId,
          start,
          end,
          size);
      return false;
    }

    Instant now = clock.instant();
    Path chunkPath = cacheDir.resolve(key + CHUNK_SUFFIX);
    Path sidecarPath = cacheDir.resolve(key + SIDECAR_SUFFIX);
    Path chunkTemp = null;
    Path sidecarTemp = null;

    try {
      // Write outside the lock, publish by rename under it
      chunkTemp = Files.createTempFile(cacheDir, key, TEMP_SUFFIX);
      Files.write(chunkTemp, data);
      sidecarTemp = Files.createTempFile(cacheDir, key, TEMP_SUFFIX);
      objectMapper.writeValue(
          sidecarTemp.toFile(),
          new ChunkSidecar(objectId, start, end, size, now.toEpochMilli()));

      lock.lock();
      try {
        if (invalidations.get() != generation) {
          LOGGER.info(
              "Dropping window fetched before an invalidation: objectId={}, range={}-{}",
              objectId,
              start,
              end);
          return false;
        }

        ChunkEntry previous = index.remove(key);
        if (previous != null) {
          unlink(previous);
        }

        if (bytesUsed + size > budgetBytes) {
          evict(size);
        }

        try {
          Files.move(chunkTemp, chunkPath, StandardCopyOption.REPLACE_EXISTING);
          chunkTemp = null;
          Files.move(sidecarTemp, sidecarPath, StandardCopyOption.REPLACE_EXISTING);
          sidecarTemp = null;
        } catch (IOException e) {
          // The previous entry, if any, is already unlinked; leave no half-published pair behind
          deleteQuietly(chunkPath);
          deleteQuietly(sidecarPath);
          throw e;
        }

        ChunkEntry entry =
            new ChunkEntry(key, objectId, start, end, size, chunkPath, sidecarPath, now, now);
        index.put(key, entry);
        keysByObject.computeIfAbsent(objectId, id -> new HashSet<>()).add(key);
        bytesUsed += size;

        structuredLogger.logCacheStored(key, objectId, start, end, size, bytesUsed);
        return true;
      } finally {
        lock.unlock();
      }

    } catch (IOException e) {
      // A failed cache write only costs a future miss
      LOGGER.error(
          "Failed to save chunk: objectId={}, range={}-{}, size={}", objectId, start, end, size, e);
      return false;
    } finally {
      deleteQuietly(chunkTemp);
      deleteQuietly(sidecarTemp);
    }
  }

  @Override
  public int invalidate(String objectId) {
    lock.lock();
    try {
      invalidations.incrementAndGet();
      Set<String> keys = keysByObject.remove(objectId);
      if (keys == null) {
        return 0;
      }
      int removed = 0;
      for (String key : keys) {
        ChunkEntry entry = index.remove(key);
        if (entry != null) {
          bytesUsed -= entry.sizeBytes();
          deleteFiles(entry);
          removed++;
        }
      }
      LOGGER.info("Invalidated {} chunks for object: objectId={}", removed, objectId);
      return removed;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void clear() {
    lock.lock();
    try {
      invalidations.incrementAndGet();
      int removedCount = index.size();
      long removedBytes = bytesUsed;
      for (ChunkEntry entry : index.values()) {
        deleteFiles(entry);
      }
      index.clear();
      keysByObject.clear();
      bytesUsed = 0;
      LOGGER.info("Cache cleared: {} files ({} bytes)", removedCount, removedBytes);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public ChunkCacheStats stats() {
    lock.lock();
    try {
      return new ChunkCacheStats(
          index.size(), bytesUsed, budgetBytes, hits.sum(), misses.sum(), cacheDir.toString());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<ChunkEntryView> topEntries(int limit) {
    Instant now = clock.instant();
    lock.lock();
    try {
      return index.values().stream()
          .sorted(Comparator.comparingLong(ChunkEntry::hitCount).reversed())
          .limit(Math.max(0, limit))
          .map(entry -> entry.toView(now))
          .collect(Collectors.toList());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Look at an entry without counting it as an access.
   *
   * @return a snapshot of the entry, or empty if the window is not cached
   */
  public Optional<ChunkEntryView> peek(String objectId, long start, long end) {
    String key = ChunkCache.generateKey(objectId, start, end);
    Instant now = clock.instant();
    lock.lock();
    try {
      // values() iteration does not reorder an access-ordered map, get() would
      return index.values().stream()
          .filter(entry -> entry.key().equals(key))
          .findFirst()
          .map(entry -> entry.toView(now));
    } finally {
      lock.unlock();
    }
  }

  public Path getCacheDir() {
    return cacheDir;
  }

  public long getBudgetBytes() {
    return budgetBytes;
  }

  /** Evict least recently used entries. Caller holds the lock. */
  private void evict(long incomingSize) {
    long targetBytes =
        Math.min((long) (budgetBytes * EVICTION_TARGET_RATIO), budgetBytes - incomingSize);

    int removedCount = 0;
    long removedBytes = 0;
    Iterator<ChunkEntry> iterator = index.values().iterator();
    while (bytesUsed > targetBytes && iterator.hasNext()) {
      ChunkEntry victim = iterator.next();
      iterator.remove();
      removeFromObjectIndex(victim);
      bytesUsed -= victim.sizeBytes();
      deleteFiles(victim);
      removedCount++;
      removedBytes += victim.sizeBytes();
    }

    if (removedCount > 0) {
      structuredLogger.logEviction(removedCount, removedBytes, bytesUsed, targetBytes);
    }
  }

  /** Drop an entry whose backing file can't be used, if it is still the indexed one. */
  private void heal(ChunkEntry entry, String reason) {
    misses.increment();
    lock.lock();
    try {
      // HashMap.remove(key, value) does not touch access order
      if (index.remove(entry.key(), entry)) {
        removeFromObjectIndex(entry);
        bytesUsed -= entry.sizeBytes();
        deleteFiles(entry);
        structuredLogger.logSelfHeal(entry.key(), entry.objectId(), reason);
      }
    } finally {
      lock.unlock();
    }
  }

  /** Forget a replaced entry's accounting; its files are overwritten by the caller. */
  private void unlink(ChunkEntry entry) {
    removeFromObjectIndex(entry);
    bytesUsed -= entry.sizeBytes();
  }

  private void removeFromObjectIndex(ChunkEntry entry) {
    Set<String> keys = keysByObject.get(entry.objectId());
    if (keys != null) {
      keys.remove(entry.key());
      if (keys.isEmpty()) {
        keysByObject.remove(entry.objectId());
      }
    }
  }

  private void deleteFiles(ChunkEntry entry) {
    deleteQuietly(entry.storagePath());
    deleteQuietly(entry.sidecarPath());
  }

  private void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete cache file: {}", path, e);
    }
  }

  /**
   * Rebuild the index from sidecars left by a previous run.
   *
   * <p>Recency is taken from each chunk file's modification time. Chunk files without a readable
   * sidecar, sidecars without a chunk file, and leftover temp files are deleted.
   */
  private void loadExistingEntries() {
    List<ChunkEntry> loaded = new ArrayList<>();
    Set<Path> knownFiles = new HashSet<>();

    try (DirectoryStream<Path> sidecars =
        Files.newDirectoryStream(cacheDir, "*" + SIDECAR_SUFFIX)) {
      for (Path sidecarPath : sidecars) {
        String fileName = sidecarPath.getFileName().toString();
        String key = fileName.substring(0, fileName.length() - SIDECAR_SUFFIX.length());
        Path chunkPath = cacheDir.resolve(key + CHUNK_SUFFIX);
        try {
          ChunkSidecar sidecar = objectMapper.readValue(sidecarPath.toFile(), ChunkSidecar.class);
          String expectedKey =
              ChunkCache.generateKey(sidecar.objectId(), sidecar.start(), sidecar.end());
          if (!key.equals(expectedKey)
              || !Files.isRegularFile(chunkPath)
              || Files.size(chunkPath) != sidecar.sizeBytes()) {
            LOGGER.warn("Discarding inconsistent cache entry: {}", key);
            continue;
          }
          Instant lastAccess = Files.getLastModifiedTime(chunkPath).toInstant();
          loaded.add(
              new ChunkEntry(
                  key,
                  sidecar.objectId(),
                  sidecar.start(),
                  sidecar.end(),
                  sidecar.sizeBytes(),
                  chunkPath,
                  sidecarPath,
                  Instant.ofEpochMilli(sidecar.createdAtEpochMs()),
                  lastAccess));
          knownFiles.add(chunkPath);
          knownFiles.add(sidecarPath);
        } catch (IOException e) {
          LOGGER.error("Failed to load cache entry {}: {}", key, e.getMessage());
        }
      }
    } catch (IOException e) {
      LOGGER.error("Failed to scan cache directory: {}", cacheDir, e);
      return;
    }

    loaded.sort(Comparator.comparing(ChunkEntry::lastAccessAt));
    for (ChunkEntry entry : loaded) {
      index.put(entry.key(), entry);
      keysByObject.computeIfAbsent(entry.objectId(), id -> new HashSet<>()).add(entry.key());
      bytesUsed += entry.sizeBytes();
    }

    removeOrphans(knownFiles);

    if (!loaded.isEmpty()) {
      LOGGER.info("Loaded {} cache files ({} bytes)", loaded.size(), bytesUsed);
    }
    if (bytesUsed > budgetBytes) {
      evict(0);
    }
  }

  private void removeOrphans(Set<Path> knownFiles) {
    try (DirectoryStream<Path> files = Files.newDirectoryStream(cacheDir)) {
      for (Path file : files) {
        String name = file.getFileName().toString();
        boolean cacheFile =
            name.endsWith(CHUNK_SUFFIX)
                || name.endsWith(SIDECAR_SUFFIX)
                || name.endsWith(TEMP_SUFFIX);
        if (cacheFile && !knownFiles.contains(file)) {
          LOGGER.info("Removing orphaned cache file: {}", file);
          deleteQuietly(file);
        }
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to remove orphaned cache files in {}", cacheDir, e);
    }
  }
}
