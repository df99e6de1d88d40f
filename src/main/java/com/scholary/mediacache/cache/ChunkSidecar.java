package com.scholary.mediacache.cache;

/**
 * JSON sidecar written next to each chunk file.
 *
 * <p>Chunk file names are hashes, so without the sidecar a restarted cache could not tell which
 * object a file belongs to and could never invalidate it.
 */
public record ChunkSidecar(
    String objectId, long start, long end, long sizeBytes, long createdAtEpochMs) {}
