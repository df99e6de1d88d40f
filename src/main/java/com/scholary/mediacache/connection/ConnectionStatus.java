package com.scholary.mediacache.connection;

import java.time.Instant;

/** Snapshot of the connection manager for health reporting. */
public record ConnectionStatus(
    boolean initialized,
    String bucket,
    long handlesCreated,
    long resetCount,
    Instant lastResetAt,
    String lastResetReason) {}
