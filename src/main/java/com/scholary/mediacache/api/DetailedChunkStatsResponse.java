package com.scholary.mediacache.api;

import java.util.List;

/** Chunk cache summary plus the most frequently hit entries. */
public record DetailedChunkStatsResponse(
    ChunkCacheStatsResponse summary, List<ChunkEntryResponse> topEntries) {}
