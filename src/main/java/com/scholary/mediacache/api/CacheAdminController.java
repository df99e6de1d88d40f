package com.scholary.mediacache.api;

import com.scholary.mediacache.cache.ChunkCache;
import com.scholary.mediacache.config.MediaCacheProperties;
import com.scholary.mediacache.connection.ObjectStoreConnectionManager;
import com.scholary.mediacache.metadata.MetadataCache;
import com.scholary.mediacache.objectstore.ObjectStoreProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Operational endpoints: cache statistics, cache clearing, connection reset and health. */
@RestController
@RequestMapping("/api")
@Tag(name = "Cache admin", description = "Cache statistics and maintenance")
public class CacheAdminController {

  private static final Logger LOGGER = LoggerFactory.getLogger(CacheAdminController.class);

  private final ChunkCache chunkCache;
  private final MetadataCache metadataCache;
  private final ObjectStoreConnectionManager connectionManager;
  private final ObjectStoreProperties objectStoreProperties;
  private final MediaCacheProperties properties;

  public CacheAdminController(
      ChunkCache chunkCache,
      MetadataCache metadataCache,
      ObjectStoreConnectionManager connectionManager,
      ObjectStoreProperties objectStoreProperties,
      MediaCacheProperties properties) {
    this.chunkCache = chunkCache;
    this.metadataCache = metadataCache;
    this.connectionManager = connectionManager;
    this.objectStoreProperties = objectStoreProperties;
    this.properties = properties;
  }

  @GetMapping("/cache/chunks/stats")
  @Operation(summary = "Chunk cache summary")
  public ChunkCacheStatsResponse chunkStats() {
    return ChunkCacheStatsResponse.from(chunkCache.stats());
  }

  @GetMapping("/cache/chunks/detailed")
  @Operation(summary = "Chunk cache summary with the most hit entries")
  public DetailedChunkStatsResponse detailedChunkStats() {
    List<ChunkEntryResponse> top =
        chunkCache.topEntries(properties.topEntries()).stream()
            .map(ChunkEntryResponse::from)
            .collect(Collectors.toList());
    return new DetailedChunkStatsResponse(ChunkCacheStatsResponse.from(chunkCache.stats()), top);
  }

  @PostMapping("/cache/chunks/clear")
  @Operation(summary = "Delete every cached chunk")
  public ChunkCacheStatsResponse clearChunks() {
    LOGGER.info("Chunk cache clear requested");
    chunkCache.clear();
    return ChunkCacheStatsResponse.from(chunkCache.stats());
  }

  @GetMapping("/cache/metadata/stats")
  @Operation(summary = "Metadata cache counters")
  public MetadataCacheStatsResponse metadataStats() {
    return MetadataCacheStatsResponse.from(metadataCache.stats());
  }

  @PostMapping("/cache/metadata/clear")
  @Operation(summary = "Drop all cached metadata")
  public MetadataCacheStatsResponse clearMetadata() {
    LOGGER.info("Metadata cache clear requested");
    metadataCache.clearAll();
    return MetadataCacheStatsResponse.from(metadataCache.stats());
  }

  @PostMapping("/connection/reset")
  @Operation(
      summary = "Rebuild the object store connection",
      description = "Discards the current client; the next request builds a new one")
  public ConnectionResponse resetConnection() {
    LOGGER.warn("Connection reset requested");
    connectionManager.forceReset();
    return connection();
  }

  @GetMapping("/health/full")
  @Operation(
      summary = "Full health check",
      description = "Probes the object store and reports connection and cache state")
  public ResponseEntity<HealthResponse> fullHealth() {
    boolean reachable = connectionManager.healthCheck();
    HealthResponse response =
        new HealthResponse(
            reachable ? "healthy" : "degraded",
            reachable,
            connection(),
            MetadataCacheStatsResponse.from(metadataCache.stats()),
            ChunkCacheStatsResponse.from(chunkCache.stats()));
    return ResponseEntity.ok(response);
  }

  private ConnectionResponse connection() {
    String credentialMode =
        objectStoreProperties.hasStaticCredentials() ? "static" : "default-chain";
    return ConnectionResponse.from(connectionManager.status(), credentialMode);
  }
}
