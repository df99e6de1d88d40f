package com.scholary.mediacache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.mediacache.cache.ChunkCache;
import com.scholary.mediacache.cache.DiskChunkCache;
import com.scholary.mediacache.connection.ObjectStoreConnectionManager;
import com.scholary.mediacache.metadata.MetadataCache;
import com.scholary.mediacache.mutation.ObjectMutationService;
import com.scholary.mediacache.range.ByteRangeResolver;
import com.scholary.mediacache.streaming.MediaStreamService;
import java.nio.file.Path;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the caches and the streaming service.
 *
 * <p>Each of these is a process-wide singleton shared by all request threads.
 */
@Configuration
@EnableConfigurationProperties(MediaCacheProperties.class)
public class MediaCacheConfig {

  @Bean
  public ByteRangeResolver byteRangeResolver(MediaCacheProperties properties) {
    return new ByteRangeResolver(
        properties.maxUnboundedRangeBytes(), properties.maxRangeChunkBytes());
  }

  @Bean
  public MetadataCache metadataCache(
      ObjectStoreConnectionManager connectionManager, MediaCacheProperties properties) {
    return new MetadataCache(connectionManager, properties.metadataCacheCapacity());
  }

  @Bean
  public ChunkCache chunkCache(MediaCacheProperties properties, ObjectMapper objectMapper) {
    return new DiskChunkCache(
        Path.of(properties.chunkCacheDir()), properties.chunkCacheBudgetBytes(), objectMapper);
  }

  @Bean
  public MediaStreamService mediaStreamService(
      ByteRangeResolver rangeResolver,
      MetadataCache metadataCache,
      ChunkCache chunkCache,
      ObjectStoreConnectionManager connectionManager,
      MediaCacheProperties properties) {
    return new MediaStreamService(
        rangeResolver, metadataCache, chunkCache, connectionManager, properties);
  }

  @Bean
  public ObjectMutationService objectMutationService(
      ObjectStoreConnectionManager connectionManager, MediaStreamService streamService) {
    return new ObjectMutationService(connectionManager, streamService);
  }
}
