package com.scholary.mediacache.mutation;

import com.scholary.mediacache.connection.ObjectStoreConnectionManager;
import com.scholary.mediacache.streaming.MediaStreamService;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Changes objects in the store and keeps the caches consistent with those changes.
 *
 * <p>Every operation runs through the connection manager, so an expired credential is recovered
 * the same way as for reads, and every affected object id is invalidated afterwards. Invalidation
 * happens even when the store call fails, since a failed write may still have been applied.
 */
public class ObjectMutationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectMutationService.class);

  private final ObjectStoreConnectionManager connectionManager;
  private final MediaStreamService streamService;

  public ObjectMutationService(
      ObjectStoreConnectionManager connectionManager, MediaStreamService streamService) {
    this.connectionManager = connectionManager;
    this.streamService = streamService;
  }

  /**
   * Store an object, replacing any existing one.
   *
   * @param objectId the object key
   * @param data the new content
   * @param contentType the MIME type, may be null
   * @param attributes custom metadata attributes
   */
  public void upload(
      String objectId, byte[] data, String contentType, Map<String, String> attributes) {
    LOGGER.info("Uploading object: objectId={}, size={} bytes", objectId, data.length);
    try {
      connectionManager.useConnection(
          client -> client.upload(objectId, data, contentType, attributes));
    } finally {
      streamService.onObjectChanged(objectId);
    }
  }

  /** Delete an object. Deleting a missing object succeeds. */
  public void delete(String objectId) {
    LOGGER.info("Deleting object: objectId={}", objectId);
    try {
      connectionManager.useConnection(client -> client.delete(objectId));
    } finally {
      streamService.onObjectChanged(objectId);
    }
  }

  /**
   * Rename an object by copying it server side and deleting the source.
   *
   * @throws IllegalArgumentException if source and target are the same key
   */
  public void rename(String sourceId, String targetId) {
    if (sourceId.equals(targetId)) {
      throw new IllegalArgumentException("Source and target are the same: " + sourceId);
    }
    LOGGER.info("Renaming object: from={}, to={}", sourceId, targetId);
    try {
      connectionManager.useConnection(
          client -> {
            client.copy(sourceId, targetId);
            client.delete(sourceId);
          });
    } finally {
      streamService.onObjectChanged(sourceId);
      streamService.onObjectChanged(targetId);
    }
  }
}
