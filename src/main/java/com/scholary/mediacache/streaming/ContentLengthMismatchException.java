package com.scholary.mediacache.streaming;

/**
 * Thrown when the store returns a different number of bytes than requested, beyond the one byte
 * that is tolerated at object boundaries.
 */
public class ContentLengthMismatchException extends RuntimeException {

  private final String objectId;
  private final long start;
  private final long end;
  private final long expectedBytes;
  private final long actualBytes;

  public ContentLengthMismatchException(
      String objectId, long start, long end, long expectedBytes, long actualBytes) {
    this(
        String.format(
            "Length mismatch for %s range %d-%d: expected %d bytes, got %d",
            objectId, start, end, expectedBytes, actualBytes),
        objectId,
        start,
        end,
        expectedBytes,
        actualBytes);
  }

  protected ContentLengthMismatchException(
      String message, String objectId, long start, long end, long expectedBytes, long actualBytes) {
    super(message);
    this.objectId = objectId;
    this.start = start;
    this.end = end;
    this.expectedBytes = expectedBytes;
    this.actualBytes = actualBytes;
  }

  public String getObjectId() {
    return objectId;
  }

  public long getStart() {
    return start;
  }

  public long getEnd() {
    return end;
  }

  public long getExpectedBytes() {
    return expectedBytes;
  }

  public long getActualBytes() {
    return actualBytes;
  }
}
