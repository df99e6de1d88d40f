package com.scholary.mediacache.range;

/**
 * An inclusive byte window within a single object.
 *
 * <p>Both ends are inclusive, so a window covering the first kilobyte is {@code [0, 1023]}. Two
 * windows of the same object are the same cache entry only when start and end are both equal;
 * overlapping windows are never merged.
 */
public record RangeWindow(long start, long end) {

  public RangeWindow {
    if (start < 0) {
      throw new IllegalArgumentException("Range start cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("Range end must be >= range start");
    }
  }

  /** Number of bytes covered by this window. */
  public long length() {
    return end - start + 1;
  }

  /**
   * Render the value of a {@code Content-Range} header for this window.
   *
   * @param objectSize the total size of the object
   * @return e.g. {@code bytes 0-999/1000}
   */
  public String toContentRange(long objectSize) {
    return String.format("bytes %d-%d/%d", start, end, objectSize);
  }
}
