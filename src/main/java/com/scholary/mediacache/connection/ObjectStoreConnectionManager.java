package com.scholary.mediacache.connection;

import com.scholary.mediacache.logging.StructuredLogger;
import com.scholary.mediacache.objectstore.ObjectStoreClient;
import com.scholary.mediacache.objectstore.ObjectStoreClientFactory;
import com.scholary.mediacache.objectstore.ObjectStoreException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single live connection to the object store.
 *
 * <p>The connection is created lazily on first use. When an operation fails because the credential
 * expired, the handle is discarded as a whole, a new one is built through the factory, and the
 * operation is retried exactly once. A second credential failure is reported as {@link
 * RemoteUnavailableException}; nothing loops.
 *
 * <p>Other failures are not retried here:
 *
 * <ul>
 *   <li>NOT_FOUND and PERMISSION_DENIED propagate unchanged as {@link ObjectStoreException}
 *   <li>TIMEOUT and TRANSPORT become {@link RemoteUnavailableException}
 * </ul>
 *
 * <p>The handle lives in an {@link AtomicReference} and is swapped, never patched, so concurrent
 * callers see either the old or the new client. When several callers hit the same expired handle
 * at once, only the first one resets it; the rest pick up the replacement.
 */
public class ObjectStoreConnectionManager implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreConnectionManager.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ObjectStoreClientFactory clientFactory;
  private final AtomicReference<ObjectStoreClient> current = new AtomicReference<>();
  private final Object createLock = new Object();
  private final List<Runnable> resetListeners = new CopyOnWriteArrayList<>();

  private final AtomicLong handlesCreated = new AtomicLong();
  private final AtomicLong resetCount = new AtomicLong();
  private volatile Instant lastResetAt;
  private volatile String lastResetReason;
  private volatile String bucket;

  public ObjectStoreConnectionManager(ObjectStoreClientFactory clientFactory) {
    this.clientFactory = clientFactory;
  }

  /**
   * Run an operation against the current connection.
   *
   * @param operation the work to run; may be invoked twice if the first attempt hits an expired
   *     credential
   * @return the operation's result
   * @throws ObjectStoreException for NOT_FOUND and PERMISSION_DENIED failures
   * @throws RemoteUnavailableException for timeouts, transport failures, and repeated credential
   *     failures
   */
  public <T> T withConnection(Function<ObjectStoreClient, T> operation) {
    ObjectStoreClient client = null;
    try {
      client = acquire();
      return operation.apply(client);
    } catch (ObjectStoreException e) {
      if (!e.isAuthExpired()) {
        throw translate(e);
      }
      reset(client, "credential expired");
    }

    try {
      ObjectStoreClient fresh = acquire();
      T result = operation.apply(fresh);
      LOGGER.info("Operation succeeded after reconnect");
      return result;
    } catch (ObjectStoreException e) {
      if (e.isAuthExpired()) {
        LOGGER.error("Credential still rejected after reconnect, giving up: {}", e.getMessage());
        throw new RemoteUnavailableException(
            "Object store rejected credentials after reconnect: " + e.getMessage(), e);
      }
      throw translate(e);
    }
  }

  /** Variant of {@link #withConnection(Function)} for operations without a result. */
  public void useConnection(Consumer<ObjectStoreClient> operation) {
    withConnection(
        client -> {
          operation.accept(client);
          return null;
        });
  }

  /**
   * Discard the current connection so the next call builds a new one.
   *
   * <p>Used for operational recovery after a failed health check, and by tests.
   */
  public void forceReset() {
    ObjectStoreClient client = current.get();
    if (client == null) {
      LOGGER.info("Force reset requested but no connection is open");
      return;
    }
    reset(client, "forced reset");
  }

  /**
   * Register a callback that runs after every connection reset.
   *
   * <p>Caches that hold data fetched under the old credential use this to drop it.
   */
  public void addResetListener(Runnable listener) {
    resetListeners.add(listener);
  }

  /**
   * Probe connectivity by listing at most one key.
   *
   * @return true if the store answered
   */
  public boolean healthCheck() {
    try {
      useConnection(ObjectStoreClient::ping);
      LOGGER.debug("Object store health check passed");
      return true;
    } catch (RuntimeException e) {
      LOGGER.error("Object store health check failed: {}", e.getMessage());
      return false;
    }
  }

  public ConnectionStatus status() {
    return new ConnectionStatus(
        current.get() != null,
        bucket,
        handlesCreated.get(),
        resetCount.get(),
        lastResetAt,
        lastResetReason);
  }

  @Override
  public void close() {
    ObjectStoreClient client = current.getAndSet(null);
    if (client != null) {
      client.close();
    }
  }

  private ObjectStoreClient acquire() {
    ObjectStoreClient client = current.get();
    if (client != null) {
      return client;
    }
    synchronized (createLock) {
      client = current.get();
      if (client == null) {
        LOGGER.info("Opening object store connection");
        client = clientFactory.create();
        handlesCreated.incrementAndGet();
        bucket = client.bucket();
        current.set(client);
      }
      return client;
    }
  }

  private void reset(ObjectStoreClient expected, String reason) {
    if (expected != null && !current.compareAndSet(expected, null)) {
      LOGGER.debug("Connection already replaced by another caller");
      return;
    }

    lastResetAt = Instant.now();
    lastResetReason = reason;
    structuredLogger.logConnectionReset(reason, resetCount.incrementAndGet());

    if (expected != null) {
      try {
        expected.close();
      } catch (RuntimeException e) {
        LOGGER.warn("Failed to close discarded connection: {}", e.getMessage());
      }
    }

    for (Runnable listener : resetListeners) {
      try {
        listener.run();
      } catch (RuntimeException e) {
        LOGGER.error("Connection reset listener failed", e);
      }
    }
  }

  private static RuntimeException translate(ObjectStoreException e) {
    switch (e.getKind()) {
      case TIMEOUT:
      case TRANSPORT:
        return new RemoteUnavailableException(
            "Object store unavailable (" + e.getKind() + "): " + e.getMessage(), e);
      default:
        return e;
    }
  }
}
