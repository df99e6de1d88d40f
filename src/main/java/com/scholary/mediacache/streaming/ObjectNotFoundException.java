package com.scholary.mediacache.streaming;

/** Thrown when a requested object does not exist in the store. */
public class ObjectNotFoundException extends RuntimeException {

  private final String objectId;

  public ObjectNotFoundException(String objectId) {
    super("Object not found: " + objectId);
    this.objectId = objectId;
  }

  public String getObjectId() {
    return objectId;
  }
}
