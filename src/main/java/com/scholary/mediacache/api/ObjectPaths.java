package com.scholary.mediacache.api;

/** Helpers for object ids captured from the rest of a request path. */
final class ObjectPaths {

  private ObjectPaths() {}

  /**
   * Turn a captured path such as {@code /videos/a.mp4} into the object id {@code videos/a.mp4}.
   *
   * @return the object id, or null if nothing is left
   */
  static String toObjectId(String capturedPath) {
    if (capturedPath == null) {
      return null;
    }
    String objectId = capturedPath.startsWith("/") ? capturedPath.substring(1) : capturedPath;
    return objectId.isBlank() ? null : objectId;
  }
}
