package com.scholary.mediacache.range;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an HTTP {@code Range} header into a validated {@link RangeWindow}.
 *
 * <p>Only the single-window form {@code bytes=<start>-<end?>} is accepted. The result is always
 * clamped to the object and capped so that no single window is longer than {@code
 * maxRangeChunkBytes}; clients re-request the bytes that follow a truncated window.
 *
 * <p>When {@code end} is omitted, the window stops after {@code maxUnboundedRangeBytes}. Naive
 * players send {@code bytes=0-} and would otherwise pull the whole object into memory.
 */
public class ByteRangeResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(ByteRangeResolver.class);

  private static final Pattern RANGE_PATTERN = Pattern.compile("^bytes=(\\d+)-(\\d*)$");

  private final long maxUnboundedRangeBytes;
  private final long maxRangeChunkBytes;

  public ByteRangeResolver(long maxUnboundedRangeBytes, long maxRangeChunkBytes) {
    if (maxUnboundedRangeBytes <= 0) {
      throw new IllegalArgumentException("maxUnboundedRangeBytes must be positive");
    }
    if (maxRangeChunkBytes <= 0) {
      throw new IllegalArgumentException("maxRangeChunkBytes must be positive");
    }
    this.maxUnboundedRangeBytes = maxUnboundedRangeBytes;
    this.maxRangeChunkBytes = maxRangeChunkBytes;
  }

  /**
   * Resolve a range header against an object of known size.
   *
   * <p>A missing header resolves to the whole object, {@code [0, objectSize - 1]}, without the
   * chunk cap; the orchestrator serves that case through its own full-object paths.
   *
   * @param rangeHeader the raw header value, or null when the client sent none
   * @param objectSize the object size in bytes, must be positive
   * @return the resolved window
   * @throws MalformedRangeException if the header does not match the expected grammar
   */
  public RangeWindow resolve(String rangeHeader, long objectSize) {
    if (objectSize <= 0) {
      throw new IllegalArgumentException("Object size must be positive: " + objectSize);
    }
    if (rangeHeader == null || rangeHeader.isBlank()) {
      return new RangeWindow(0, objectSize - 1);
    }

    Matcher matcher = RANGE_PATTERN.matcher(rangeHeader.trim());
    if (!matcher.matches()) {
      throw new MalformedRangeException(rangeHeader);
    }

    long lastByte = objectSize - 1;
    long start;
    long end;
    try {
      start = Long.parseLong(matcher.group(1));
      if (matcher.group(2).isEmpty()) {
        end = Math.min(saturatedEnd(start, maxUnboundedRangeBytes), lastByte);
      } else {
        end = Long.parseLong(matcher.group(2));
      }
    } catch (NumberFormatException e) {
      throw new MalformedRangeException(rangeHeader, e);
    }

    start = Math.max(0, Math.min(start, lastByte));
    end = Math.max(start, Math.min(end, lastByte));

    if (end - start + 1 > maxRangeChunkBytes) {
      long requestedEnd = end;
      end = start + maxRangeChunkBytes - 1;
      LOGGER.debug(
          "Truncated range: requested={}-{}, served={}-{}", start, requestedEnd, start, end);
    }

    RangeWindow window = new RangeWindow(start, end);
    LOGGER.debug(
        "Resolved range: header={}, window={}-{}/{}, length={}",
        rangeHeader,
        start,
        end,
        objectSize,
        window.length());
    return window;
  }

  public long getMaxUnboundedRangeBytes() {
    return maxUnboundedRangeBytes;
  }

  public long getMaxRangeChunkBytes() {
    return maxRangeChunkBytes;
  }

  // start + length - 1 without wrapping past Long.MAX_VALUE
  private static long saturatedEnd(long start, long length) {
    long end = start + length - 1;
    return end < start ? Long.MAX_VALUE : end;
  }
}
