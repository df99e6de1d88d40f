package com.scholary.mediacache.objectstore;

/**
 * Creates fresh object store connections.
 *
 * <p>Each call must return a new client with newly resolved credentials. The connection manager
 * calls this lazily on first use and again after every credential expiry.
 */
@FunctionalInterface
public interface ObjectStoreClientFactory {

  /**
   * Build a new client.
   *
   * @return a new, independent client
   * @throws ObjectStoreException if the client cannot be created (e.g. no credentials available)
   */
  ObjectStoreClient create();
}
