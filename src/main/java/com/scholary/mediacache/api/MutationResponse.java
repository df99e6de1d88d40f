package com.scholary.mediacache.api;

/** Result of an upload, delete or rename. */
public record MutationResponse(String action, String objectId, String previousObjectId) {

  public static MutationResponse of(String action, String objectId) {
    return new MutationResponse(action, objectId, null);
  }
}
