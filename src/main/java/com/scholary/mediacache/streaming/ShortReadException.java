package com.scholary.mediacache.streaming;

/** The store returned fewer bytes than requested. */
public class ShortReadException extends ContentLengthMismatchException {

  public ShortReadException(
      String objectId, long start, long end, long expectedBytes, long actualBytes) {
    super(
        String.format(
            "Short read for %s range %d-%d: expected %d bytes, got %d",
            objectId, start, end, expectedBytes, actualBytes),
        objectId,
        start,
        end,
        expectedBytes,
        actualBytes);
  }
}
