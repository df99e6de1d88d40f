package com.scholary.mediacache.objectstore;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for object storage.
 *
 * <p>These map to the "objectstore.*" keys in application.yml. Leave {@code accessKey} and {@code
 * secretKey} blank to use the SDK default credential chain (environment, profile, web identity,
 * instance role); that chain is resolved again every time the connection is rebuilt, which is how
 * an expired session credential gets replaced. Leave {@code endpoint} blank for AWS itself; set it
 * for MinIO and other S3-compatible stores.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    String endpoint,
    String accessKey,
    String secretKey,
    @NotBlank String bucket,
    @DefaultValue("us-east-1") String region,
    boolean pathStyleAccess,
    @NotNull @DefaultValue("30s") Duration callTimeout,
    @NotNull @DefaultValue("10s") Duration attemptTimeout) {

  public ObjectStoreProperties {
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("objectstore.bucket must not be blank");
    }
    if (callTimeout == null || callTimeout.isNegative() || callTimeout.isZero()) {
      throw new IllegalArgumentException("objectstore.callTimeout must be positive");
    }
    if (attemptTimeout == null || attemptTimeout.isNegative() || attemptTimeout.isZero()) {
      throw new IllegalArgumentException("objectstore.attemptTimeout must be positive");
    }
  }

  /** True when a static access key pair is configured. */
  public boolean hasStaticCredentials() {
    return accessKey != null && !accessKey.isBlank() && secretKey != null && !secretKey.isBlank();
  }

  /** True when a custom endpoint (MinIO, GCS interoperability, ...) is configured. */
  public boolean hasEndpointOverride() {
    return endpoint != null && !endpoint.isBlank();
  }
}
