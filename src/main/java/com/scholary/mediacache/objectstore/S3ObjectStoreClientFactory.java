package com.scholary.mediacache.objectstore;

/** Builds a new {@link S3ObjectStoreClient}, with freshly resolved credentials, per call. */
public class S3ObjectStoreClientFactory implements ObjectStoreClientFactory {

  private final ObjectStoreProperties properties;

  public S3ObjectStoreClientFactory(ObjectStoreProperties properties) {
    this.properties = properties;
  }

  @Override
  public ObjectStoreClient create() {
    return new S3ObjectStoreClient(properties);
  }

  public ObjectStoreProperties getProperties() {
    return properties;
  }
}
