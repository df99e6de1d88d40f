package com.scholary.mediacache.api;

import com.scholary.mediacache.connection.ConnectionStatus;
import java.time.Instant;

/** Connection manager state as reported by the admin endpoints. */
public record ConnectionResponse(
    boolean initialized,
    String bucket,
    String credentialMode,
    long handlesCreated,
    long resetCount,
    Instant lastResetAt,
    String lastResetReason) {

  public static ConnectionResponse from(ConnectionStatus status, String credentialMode) {
    return new ConnectionResponse(
        status.initialized(),
        status.bucket(),
        credentialMode,
        status.handlesCreated(),
        status.resetCount(),
        status.lastResetAt(),
        status.lastResetReason());
  }
}
