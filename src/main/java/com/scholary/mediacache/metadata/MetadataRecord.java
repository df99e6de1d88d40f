package com.scholary.mediacache.metadata;

import java.time.Instant;
import java.util.Map;

/**
 * Metadata of one remote object as last fetched from the store.
 *
 * <p>Immutable; a changed object gets a new record, never an updated one.
 */
public record MetadataRecord(
    long size, String contentType, String etag, Map<String, String> attributes, Instant fetchedAt) {

  public MetadataRecord {
    if (size < 0) {
      throw new IllegalArgumentException("Object size cannot be negative");
    }
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    if (fetchedAt == null) {
      fetchedAt = Instant.now();
    }
  }

  /**
   * Content type to put on responses.
   *
   * @param fallback used when the store did not record one
   */
  public String contentTypeOr(String fallback) {
    return contentType == null || contentType.isBlank() ? fallback : contentType;
  }
}
