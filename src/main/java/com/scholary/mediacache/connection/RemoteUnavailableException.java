package com.scholary.mediacache.connection;

/**
 * Thrown when the object store cannot serve a request: a timeout, a transport failure, or a
 * credential that stayed invalid after the one permitted reconnect.
 *
 * <p>This is an availability problem on our side, never the client's fault; the HTTP layer maps it
 * to 503.
 */
public class RemoteUnavailableException extends RuntimeException {

  public RemoteUnavailableException(String message) {
    super(message);
  }

  public RemoteUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
