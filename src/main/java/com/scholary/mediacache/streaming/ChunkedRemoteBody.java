package com.scholary.mediacache.streaming;

import com.scholary.mediacache.connection.ObjectStoreConnectionManager;
import com.scholary.mediacache.logging.StructuredLogger;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Body for large objects, fetched from the store one fixed-size chunk at a time as it is written.
 *
 * <p>The sequence is forward-only and single-use: a new request gets a new instance. Chunks are
 * not put into the chunk cache. If the store returns an empty chunk before the declared size is
 * reached, the sequence ends early and the short read is logged. Once {@link #cancel()} is called,
 * no further remote fetch is issued.
 */
public class ChunkedRemoteBody implements ResponseBody, Iterator<byte[]> {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkedRemoteBody.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ObjectStoreConnectionManager connectionManager;
  private final String objectId;
  private final long size;
  private final int chunkBytes;

  private long position;
  private boolean exhausted;
  private volatile boolean cancelled;

  public ChunkedRemoteBody(
      ObjectStoreConnectionManager connectionManager, String objectId, long size, int chunkBytes) {
    if (chunkBytes <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive: " + chunkBytes);
    }
    this.connectionManager = connectionManager;
    this.objectId = objectId;
    this.size = size;
    this.chunkBytes = chunkBytes;
  }

  @Override
  public long contentLength() {
    return size;
  }

  @Override
  public boolean hasNext() {
    return !cancelled && !exhausted && position < size;
  }

  @Override
  public byte[] next() {
    if (!hasNext()) {
      throw new NoSuchElementException("No more chunks for " + objectId);
    }

    long start = position;
    long end = Math.min(start + chunkBytes - 1, size - 1);
    byte[] chunk =
        connectionManager.withConnection(client -> client.fetchRange(objectId, start, end));

    if (chunk.length == 0) {
      exhausted = true;
      structuredLogger.logStreamShortRead(objectId, position, size);
      return chunk;
    }

    position += chunk.length;
    return chunk;
  }

  @Override
  public void writeTo(OutputStream out) throws IOException {
    try {
      while (hasNext()) {
        byte[] chunk = next();
        if (chunk.length > 0) {
          out.write(chunk);
          out.flush();
        }
      }
      if (cancelled) {
        LOGGER.info("Stream cancelled: objectId={}, position={}/{}", objectId, position, size);
      }
    } catch (IOException e) {
      // Client went away, stop fetching
      cancel();
      LOGGER.info(
          "Client disconnected mid-stream: objectId={}, position={}/{}", objectId, position, size);
      throw e;
    }
  }

  @Override
  public void cancel() {
    cancelled = true;
  }

  /** Bytes handed out so far. */
  public long position() {
    return position;
  }
}
