package com.scholary.mediacache.streaming;

import com.scholary.mediacache.cache.ChunkCache;
import com.scholary.mediacache.config.MediaCacheProperties;
import com.scholary.mediacache.connection.ObjectStoreConnectionManager;
import com.scholary.mediacache.logging.StructuredLogger;
import com.scholary.mediacache.metadata.MetadataCache;
import com.scholary.mediacache.metadata.MetadataRecord;
import com.scholary.mediacache.objectstore.ObjectStoreException;
import com.scholary.mediacache.objectstore.ObjectStoreException.ErrorKind;
import com.scholary.mediacache.range.ByteRangeResolver;
import com.scholary.mediacache.range.MalformedRangeException;
import com.scholary.mediacache.range.RangeWindow;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

/**
 * Serves byte ranges and whole objects from the store through the caches.
 *
 * <p>Request paths:
 *
 * <ul>
 *   <li>Range header: resolve the window, answer from the chunk cache or fetch exactly that window
 *       and cache it, status 206
 *   <li>No range, small object: fetch the whole object into memory, status 200
 *   <li>No range, large object: stream it in fixed-size chunks without caching, status 200
 * </ul>
 *
 * <p>A malformed range header is not an error; the whole object is served instead. Zero-length
 * objects are always answered with 200 and an empty body.
 *
 * <p>The store may return one byte more or less than asked for. One byte short is served with the
 * range end moved in to the actual length. One byte long is not served at its actual length: the
 * extra byte is cut off so that {@code Content-Range} never reaches past the requested window or
 * the end of the object. Either way the result is cached under the requested window.
 *
 * <p>Whoever mutates an object must call {@link #onObjectChanged(String)} afterwards.
 */
public class MediaStreamService {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaStreamService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String CACHE_STATUS_HEADER = "X-Cache";

  private final ByteRangeResolver rangeResolver;
  private final MetadataCache metadataCache;
  private final ChunkCache chunkCache;
  private final ObjectStoreConnectionManager connectionManager;
  private final MediaCacheProperties properties;

  public MediaStreamService(
      ByteRangeResolver rangeResolver,
      MetadataCache metadataCache,
      ChunkCache chunkCache,
      ObjectStoreConnectionManager connectionManager,
      MediaCacheProperties properties) {
    this.rangeResolver = rangeResolver;
    this.metadataCache = metadataCache;
    this.chunkCache = chunkCache;
    this.connectionManager = connectionManager;
    this.properties = properties;
  }

  /**
   * Serve an object or a byte range of it.
   *
   * @param objectId the object key
   * @param rangeHeader the raw Range header, or null
   * @return status, headers and a body that is written when the caller drains it
   * @throws ObjectNotFoundException if the object does not exist
   * @throws ContentLengthMismatchException if the store returned the wrong number of bytes
   * @throws com.scholary.mediacache.connection.RemoteUnavailableException if the store can't be
   *     reached
   */
  public MediaResponse serve(String objectId, String rangeHeader) {
    MetadataRecord metadata = lookup(objectId);

    if (metadata.size() == 0) {
      LOGGER.debug("Serving zero-length object: objectId={}", objectId);
      return new MediaResponse(200, baseHeaders(metadata, 0), BufferedBody.empty());
    }

    if (rangeHeader != null && !rangeHeader.isBlank()) {
      try {
        RangeWindow window = rangeResolver.resolve(rangeHeader, metadata.size());
        return serveRange(objectId, metadata, window);
      } catch (MalformedRangeException e) {
        LOGGER.warn(
            "Malformed range header, serving whole object: objectId={}, range={}",
            objectId,
            e.getRangeHeader());
      }
    }

    return serveWhole(objectId, metadata);
  }

  /**
   * Resolve the headers a plain GET would carry, without a body.
   *
   * @throws ObjectNotFoundException if the object does not exist
   */
  public MediaResponse head(String objectId) {
    MetadataRecord metadata = lookup(objectId);
    return new MediaResponse(200, baseHeaders(metadata, metadata.size()), BufferedBody.empty());
  }

  /** Drop everything cached about an object. Call after upload, delete or rename. */
  public void onObjectChanged(String objectId) {
    metadataCache.invalidate(objectId);
    int removed = chunkCache.invalidate(objectId);
    LOGGER.info("Object changed, caches invalidated: objectId={}, chunks={}", objectId, removed);
  }

  private MediaResponse serveRange(String objectId, MetadataRecord metadata, RangeWindow window) {
    long start = window.start();
    Optional<byte[]> cached = chunkCache.get(objectId, start, window.end());

    byte[] data;
    String cacheStatus;
    if (cached.isPresent()) {
      data = cached.get();
      cacheStatus = "HIT";
    } else {
      // An invalidation landing during the fetch must win over the bytes it returns
      long generation = chunkCache.generation();
      data = fetchWindow(objectId, window);
      chunkCache.set(objectId, start, window.end(), data, generation);
      cacheStatus = "MISS";
    }

    // The stored length may be one short of the requested window
    RangeWindow served = new RangeWindow(start, start + data.length - 1);

    HttpHeaders headers = baseHeaders(metadata, data.length);
    headers.set(HttpHeaders.CONTENT_RANGE, served.toContentRange(metadata.size()));
    headers.set(CACHE_STATUS_HEADER, cacheStatus);
    return new MediaResponse(206, headers, new BufferedBody(data));
  }

  private MediaResponse serveWhole(String objectId, MetadataRecord metadata) {
    long size = metadata.size();

    if (size >= properties.fullBufferThresholdBytes()) {
      LOGGER.info(
          "Streaming large object in chunks: objectId={}, size={}, chunkBytes={}",
          objectId,
          size,
          properties.streamingChunkBytes());
      ChunkedRemoteBody body =
          new ChunkedRemoteBody(
              connectionManager, objectId, size, properties.streamingChunkBytes());
      return new MediaResponse(200, baseHeaders(metadata, size), body);
    }

    RangeWindow whole = new RangeWindow(0, size - 1);
    long startedAt = System.currentTimeMillis();
    byte[] data =
        remote(objectId, () -> connectionManager.withConnection(c -> c.fetchFull(objectId)));
    structuredLogger.logRemoteFetch(
        objectId, 0, size - 1, data.length, System.currentTimeMillis() - startedAt);
    data = reconcileLength(objectId, whole, data);

    return new MediaResponse(200, baseHeaders(metadata, data.length), new BufferedBody(data));
  }

  private byte[] fetchWindow(String objectId, RangeWindow window) {
    long startedAt = System.currentTimeMillis();
    byte[] data =
        remote(
            objectId,
            () ->
                connectionManager.withConnection(
                    client -> client.fetchRange(objectId, window.start(), window.end())));
    structuredLogger.logRemoteFetch(
        objectId,
        window.start(),
        window.end(),
        data.length,
        System.currentTimeMillis() - startedAt);
    return reconcileLength(objectId, window, data);
  }

  /**
   * Accept a result at most one byte off the requested length.
   *
   * <p>One byte short is served as is with the end moved in; one byte long is cut back to the
   * requested window. Anything else fails.
   */
  private byte[] reconcileLength(String objectId, RangeWindow window, byte[] data) {
    long expected = window.length();
    long actual = data.length;
    if (actual == expected) {
      return data;
    }

    boolean tolerated = actual > 0 && Math.abs(actual - expected) <= 1;
    structuredLogger.logLengthMismatch(
        objectId, window.start(), window.end(), expected, actual, tolerated);

    if (!tolerated) {
      if (actual < expected) {
        throw new ShortReadException(objectId, window.start(), window.end(), expected, actual);
      }
      throw new ContentLengthMismatchException(
          objectId, window.start(), window.end(), expected, actual);
    }
    return actual > expected ? Arrays.copyOf(data, (int) expected) : data;
  }

  private MetadataRecord lookup(String objectId) {
    return metadataCache.get(objectId).orElseThrow(() -> new ObjectNotFoundException(objectId));
  }

  /** Run a fetch, turning a vanished object into a not-found and forgetting its metadata. */
  private byte[] remote(String objectId, Supplier<byte[]> fetch) {
    try {
      return fetch.get();
    } catch (ObjectStoreException e) {
      if (e.getKind() == ErrorKind.NOT_FOUND) {
        LOGGER.warn("Object disappeared after metadata lookup: objectId={}", objectId);
        onObjectChanged(objectId);
        throw new ObjectNotFoundException(objectId);
      }
      throw e;
    }
  }

  private HttpHeaders baseHeaders(MetadataRecord metadata, long contentLength) {
    HttpHeaders headers = new HttpHeaders();
    headers.set(HttpHeaders.ACCEPT_RANGES, "bytes");
    headers.set(
        HttpHeaders.CONTENT_TYPE, metadata.contentTypeOr(properties.defaultContentType()));
    headers.setContentLength(contentLength);
    headers.set(HttpHeaders.CACHE_CONTROL, properties.cacheControl());
    if (metadata.etag() != null && !metadata.etag().isBlank()) {
      headers.set(HttpHeaders.ETAG, quoted(metadata.etag()));
    }
    return headers;
  }

  private static String quoted(String etag) {
    if (etag.startsWith("\"") || etag.startsWith("W/\"")) {
      return etag;
    }
    return "\"" + etag + "\"";
  }
}
