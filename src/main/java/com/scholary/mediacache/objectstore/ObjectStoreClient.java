package com.scholary.mediacache.objectstore;

import com.scholary.mediacache.metadata.MetadataRecord;
import java.util.Map;

/**
 * Abstraction for the remote object store.
 *
 * <p>One instance represents one live connection and one credential. Instances are created by an
 * {@link ObjectStoreClientFactory} and owned by the connection manager, which throws a client away
 * and builds a new one when its credential expires; nothing else should hold on to a client.
 *
 * <p>All operations report failures as {@link ObjectStoreException} with an {@link
 * ObjectStoreException.ErrorKind}, never as SDK exceptions.
 */
public interface ObjectStoreClient extends AutoCloseable {

  /** The bucket this client reads from and writes to. */
  String bucket();

  /**
   * Check whether an object exists.
   *
   * @param objectId the object key
   * @return true if the object exists
   * @throws ObjectStoreException for any failure other than "not found"
   */
  boolean exists(String objectId);

  /**
   * Get object metadata without downloading the content.
   *
   * @param objectId the object key
   * @return the metadata, stamped with the time it was fetched
   * @throws ObjectStoreException with kind NOT_FOUND if the object doesn't exist
   */
  MetadataRecord fetchMetadata(String objectId);

  /**
   * Retrieve a byte range from an object.
   *
   * <p>The returned array may be shorter than requested if the store stops early; the caller checks
   * the length.
   *
   * @param objectId the object key
   * @param start the starting byte position (inclusive)
   * @param end the ending byte position (inclusive)
   * @return the bytes of the range
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  byte[] fetchRange(String objectId, long start, long end);

  /**
   * Retrieve a whole object into memory. Only meant for small objects.
   *
   * @param objectId the object key
   * @return the object content
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  byte[] fetchFull(String objectId);

  /**
   * Store an object, replacing any existing object with the same key.
   *
   * @param objectId the object key
   * @param data the object content
   * @param contentType the MIME type, may be null
   * @param attributes custom metadata attributes, may be empty
   * @throws ObjectStoreException if the upload fails
   */
  void upload(String objectId, byte[] data, String contentType, Map<String, String> attributes);

  /**
   * Delete an object. Deleting a missing object is not an error.
   *
   * @param objectId the object key
   * @throws ObjectStoreException if the delete fails
   */
  void delete(String objectId);

  /**
   * Server-side copy of an object within the bucket.
   *
   * @param sourceId the key to copy from
   * @param targetId the key to copy to
   * @throws ObjectStoreException if the source doesn't exist or the copy fails
   */
  void copy(String sourceId, String targetId);

  /**
   * Cheap connectivity probe used by health checks.
   *
   * @throws ObjectStoreException if the store cannot be reached with the current credential
   */
  void ping();

  /** Release connections and threads held by this client. */
  @Override
  void close();
}
