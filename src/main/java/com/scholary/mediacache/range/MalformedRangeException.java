package com.scholary.mediacache.range;

/**
 * Thrown when a {@code Range} header does not match {@code bytes=<start>-<end?>}.
 *
 * <p>Callers recover by serving the whole object instead of a window.
 */
public class MalformedRangeException extends RuntimeException {

  private final String rangeHeader;

  public MalformedRangeException(String rangeHeader) {
    super("Malformed range header: " + rangeHeader);
    this.rangeHeader = rangeHeader;
  }

  public MalformedRangeException(String rangeHeader, Throwable cause) {
    super("Malformed range header: " + rangeHeader, cause);
    this.rangeHeader = rangeHeader;
  }

  public String getRangeHeader() {
    return rangeHeader;
  }
}
