package com.scholary.mediacache.objectstore;

/**
 * Exception thrown when an object storage operation fails.
 *
 * <p>Every failure carries an {@link ErrorKind} so callers can decide what to do without looking at
 * SDK exception types. Only {@link ErrorKind#AUTH_EXPIRED} is ever answered with a reconnect; the
 * other kinds are either final ({@code NOT_FOUND}, {@code PERMISSION_DENIED}) or transient
 * failures that are reported as unavailability.
 */
public class ObjectStoreException extends RuntimeException {

  /** Classification of a remote failure. */
  public enum ErrorKind {
    /** The object (or bucket) does not exist. */
    NOT_FOUND,
    /** The credential behind the connection expired or could not be refreshed. */
    AUTH_EXPIRED,
    /** The credential is valid but not allowed to perform the operation. */
    PERMISSION_DENIED,
    /** The call did not complete within the configured timeout. */
    TIMEOUT,
    /** Any other network or service failure. */
    TRANSPORT
  }

  private final ErrorKind kind;

  public ObjectStoreException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ObjectStoreException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public boolean isAuthExpired() {
    return kind == ErrorKind.AUTH_EXPIRED;
  }
}
