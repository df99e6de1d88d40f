package com.scholary.mediacache.config;

import com.scholary.mediacache.connection.ObjectStoreConnectionManager;
import com.scholary.mediacache.objectstore.ObjectStoreClientFactory;
import com.scholary.mediacache.objectstore.ObjectStoreProperties;
import com.scholary.mediacache.objectstore.S3ObjectStoreClientFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>The application never holds an S3 client directly. It holds a factory and the connection
 * manager, which builds a client on first use and rebuilds it when the credential expires.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  public ObjectStoreClientFactory objectStoreClientFactory(ObjectStoreProperties properties) {
    return new S3ObjectStoreClientFactory(properties);
  }

  @Bean(destroyMethod = "close")
  public ObjectStoreConnectionManager objectStoreConnectionManager(
      ObjectStoreClientFactory clientFactory) {
    return new ObjectStoreConnectionManager(clientFactory);
  }
}
