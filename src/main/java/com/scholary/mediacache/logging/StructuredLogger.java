package com.scholary.mediacache.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log cache, connection and streaming events with structured fields that
 * can be queried once the logs are shipped to a search backend.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log chunk cache hit event. */
  public void logCacheHit(
      String cacheKey, String objectId, long start, long end, int bytes, long hits) {
    try {
      MDC.put("event_type", "chunk_cache_hit");
      MDC.put("cacheKey", cacheKey);
      putWindow(objectId, start, end);
      MDC.put("bytes", String.valueOf(bytes));
      MDC.put("hits", String.valueOf(hits));

      logger.debug(
          "Cache HIT: key={}, objectId={}, range={}-{}, bytes={}, hits={}",
          abbreviate(cacheKey),
          objectId,
          start,
          end,
          bytes,
          hits);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk cache miss event. */
  public void logCacheMiss(String objectId, long start, long end) {
    try {
      MDC.put("event_type", "chunk_cache_miss");
      putWindow(objectId, start, end);

      logger.debug("Cache MISS: objectId={}, range={}-{}", objectId, start, end);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk stored event. */
  public void logCacheStored(
      String cacheKey, String objectId, long start, long end, long bytes, long bytesUsed) {
    try {
      MDC.put("event_type", "chunk_cache_stored");
      MDC.put("cacheKey", cacheKey);
      putWindow(objectId, start, end);
      MDC.put("bytes", String.valueOf(bytes));
      MDC.put("bytesUsed", String.valueOf(bytesUsed));

      logger.debug(
          "Cached: key={}, objectId={}, range={}-{}, bytes={}, total={}",
          abbreviate(cacheKey),
          objectId,
          start,
          end,
          bytes,
          bytesUsed);
    } finally {
      clearEventFields();
    }
  }

  /** Log eviction pass event. */
  public void logEviction(int removedCount, long removedBytes, long bytesUsed, long targetBytes) {
    try {
      MDC.put("event_type", "chunk_cache_eviction");
      MDC.put("removedCount", String.valueOf(removedCount));
      MDC.put("removedBytes", String.valueOf(removedBytes));
      MDC.put("bytesUsed", String.valueOf(bytesUsed));
      MDC.put("targetBytes", String.valueOf(targetBytes));

      logger.info(
          "Evicted {} chunks ({} bytes), usage now {} bytes, target {} bytes",
          removedCount,
          removedBytes,
          bytesUsed,
          targetBytes);
    } finally {
      clearEventFields();
    }
  }

  /** Log an index entry dropped because its backing file is gone or unreadable. */
  public void logSelfHeal(String cacheKey, String objectId, String reason) {
    try {
      MDC.put("event_type", "chunk_cache_self_heal");
      MDC.put("cacheKey", cacheKey);
      MDC.put("eventObjectId", objectId);
      MDC.put("reason", reason);

      logger.warn(
          "Dropped cache entry: key={}, objectId={}, reason={}",
          abbreviate(cacheKey),
          objectId,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log connection reset event. */
  public void logConnectionReset(String reason, long resetCount) {
    try {
      MDC.put("event_type", "connection_reset");
      MDC.put("reason", reason);
      MDC.put("resetCount", String.valueOf(resetCount));

      logger.warn("Resetting object store connection: reason={}, resets={}", reason, resetCount);
    } finally {
      clearEventFields();
    }
  }

  /** Log remote range fetch event. */
  public void logRemoteFetch(String objectId, long start, long end, int bytes, long fetchMs) {
    try {
      MDC.put("event_type", "remote_fetch");
      putWindow(objectId, start, end);
      MDC.put("bytes", String.valueOf(bytes));
      MDC.put("fetchMs", String.valueOf(fetchMs));

      logger.info(
          "Fetched from remote: objectId={}, range={}-{}, bytes={}, time={}ms",
          objectId,
          start,
          end,
          bytes,
          fetchMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a remote response whose length differs from the requested window. */
  public void logLengthMismatch(
      String objectId, long start, long end, long expected, long actual, boolean tolerated) {
    try {
      MDC.put("event_type", "length_mismatch");
      putWindow(objectId, start, end);
      MDC.put("expected", String.valueOf(expected));
      MDC.put("actual", String.valueOf(actual));
      MDC.put("tolerated", String.valueOf(tolerated));

      if (tolerated) {
        logger.warn(
            "Adjusting content length: objectId={}, range={}-{}, expected={}, actual={}",
            objectId,
            start,
            end,
            expected,
            actual);
      } else {
        logger.error(
            "Content length mismatch: objectId={}, range={}-{}, expected={}, actual={}",
            objectId,
            start,
            end,
            expected,
            actual);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log a chunked stream that ended before the declared size. */
  public void logStreamShortRead(String objectId, long position, long size) {
    try {
      MDC.put("event_type", "stream_short_read");
      MDC.put("eventObjectId", objectId);
      MDC.put("position", String.valueOf(position));
      MDC.put("size", String.valueOf(size));

      logger.warn(
          "Empty chunk from remote, stopping stream: objectId={}, position={}, size={}",
          objectId,
          position,
          size);
    } finally {
      clearEventFields();
    }
  }

  /** Set request context in MDC. */
  public static void setRequestContext(String requestId, String objectId) {
    MDC.put("requestId", requestId);
    MDC.put("objectId", objectId);
  }

  /** Clear request context from MDC. */
  public static void clearRequestContext() {
    MDC.remove("requestId");
    MDC.remove("objectId");
  }

  private static String abbreviate(String cacheKey) {
    return cacheKey.length() > 16 ? cacheKey.substring(0, 16) + "..." : cacheKey;
  }

  private static void putWindow(String objectId, long start, long end) {
    MDC.put("eventObjectId", objectId);
    MDC.put("rangeStart", String.valueOf(start));
    MDC.put("rangeEnd", String.valueOf(end));
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("eventObjectId");
    MDC.remove("cacheKey");
    MDC.remove("rangeStart");
    MDC.remove("rangeEnd");
    MDC.remove("bytes");
    MDC.remove("hits");
    MDC.remove("bytesUsed");
    MDC.remove("removedCount");
    MDC.remove("removedBytes");
    MDC.remove("targetBytes");
    MDC.remove("reason");
    MDC.remove("resetCount");
    MDC.remove("fetchMs");
    MDC.remove("expected");
    MDC.remove("actual");
    MDC.remove("tolerated");
    MDC.remove("position");
    MDC.remove("size");
  }
}
