package com.scholary.mediacache.objectstore;

import com.scholary.mediacache.metadata.MetadataRecord;
import com.scholary.mediacache.objectstore.ObjectStoreException.ErrorKind;
import java.net.URI;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>This uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO. The
 * key difference is the endpoint and path-style access configuration.
 *
 * <p>Every SDK failure is translated into an {@link ObjectStoreException} with an {@link
 * ErrorKind}. Expired session tokens show up as error codes such as {@code ExpiredToken} rather
 * than as a dedicated exception type, so classification looks at the AWS error code first and the
 * HTTP status second.
 */
public class S3ObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  static final Set<String> AUTH_EXPIRED_CODES =
      Set.of(
          "ExpiredToken",
          "ExpiredTokenException",
          "TokenRefreshRequired",
          "InvalidToken",
          "RequestExpired");

  private final S3Client s3Client;
  private final String bucket;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    this(buildS3Client(properties), properties.bucket());
  }

  S3ObjectStoreClient(S3Client s3Client, String bucket) {
    this.s3Client = s3Client;
    this.bucket = bucket;
  }

  private static S3Client buildS3Client(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}, staticCredentials={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess(),
        properties.hasStaticCredentials());

    // A new default chain per client, so a rebuilt connection re-reads rotated credentials
    AwsCredentialsProvider credentialsProvider =
        properties.hasStaticCredentials()
            ? StaticCredentialsProvider.create(
                AwsBasicCredentials.create(properties.accessKey(), properties.secretKey()))
            : DefaultCredentialsProvider.builder().build();

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    ClientOverrideConfiguration overrideConfiguration =
        ClientOverrideConfiguration.builder()
            .apiCallTimeout(properties.callTimeout())
            .apiCallAttemptTimeout(properties.attemptTimeout())
            .build();

    S3ClientBuilder builder =
        S3Client.builder()
            .region(region)
            .credentialsProvider(credentialsProvider)
            .overrideConfiguration(overrideConfiguration)
            .forcePathStyle(properties.pathStyleAccess()); // Required for MinIO

    if (properties.hasEndpointOverride()) {
      builder.endpointOverride(URI.create(properties.endpoint()));
    }

    try {
      S3Client client = builder.build();
      LOGGER.info("S3 client initialized successfully");
      return client;
    } catch (SdkClientException e) {
      throw failure("create client", properties.bucket(), e);
    }
  }

  @Override
  public String bucket() {
    return bucket;
  }

  @Override
  public boolean exists(String objectId) {
    try {
      s3Client.headObject(headRequest(objectId));
      return true;
    } catch (Exception e) {
      ObjectStoreException failure =
          failure("check existence of", objectId, e, classifyHead(e));
      if (failure.getKind() == ErrorKind.NOT_FOUND) {
        return false;
      }
      throw failure;
    }
  }

  @Override
  public MetadataRecord fetchMetadata(String objectId) {
    LOGGER.debug("Getting metadata for object: bucket={}, key={}", bucket, objectId);

    try {
      HeadObjectResponse response = s3Client.headObject(headRequest(objectId));
      long size = response.contentLength() == null ? 0L : response.contentLength();

      LOGGER.debug(
          "Retrieved metadata: bucket={}, key={}, size={} bytes, contentType={}",
          bucket,
          objectId,
          size,
          response.contentType());

      return new MetadataRecord(
          size, response.contentType(), response.eTag(), response.metadata(), Instant.now());

    } catch (Exception e) {
      throw failure("get metadata for", objectId, e, classifyHead(e));
    }
  }

  @Override
  public byte[] fetchRange(String objectId, long start, long end) {
    LOGGER.debug(
        "Fetching byte range: bucket={}, key={}, range={}-{}", bucket, objectId, start, end);

    try {
      GetObjectRequest request =
          GetObjectRequest.builder()
              .bucket(bucket)
              .key(objectId)
              .range(String.format("bytes=%d-%d", start, end))
              .build();

      byte[] data = s3Client.getObjectAsBytes(request).asByteArray();

      LOGGER.debug(
          "Retrieved byte range: bucket={}, key={}, bytes={}-{}, received={}",
          bucket,
          objectId,
          start,
          end,
          data.length);
      return data;

    } catch (Exception e) {
      throw failure(String.format("retrieve range %d-%d of", start, end), objectId, e);
    }
  }

  @Override
  public byte[] fetchFull(String objectId) {
    LOGGER.debug("Fetching object: bucket={}, key={}", bucket, objectId);

    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(objectId).build();
      byte[] data = s3Client.getObjectAsBytes(request).asByteArray();

      LOGGER.info(
          "Retrieved object: bucket={}, key={}, size={} bytes", bucket, objectId, data.length);
      return data;

    } catch (Exception e) {
      throw failure("retrieve", objectId, e);
    }
  }

  @Override
  public void upload(
      String objectId, byte[] data, String contentType, Map<String, String> attributes) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
        bucket,
        objectId,
        data.length,
        contentType);

    try {
      PutObjectRequest.Builder request =
          PutObjectRequest.builder().bucket(bucket).key(objectId).contentLength((long) data.length);
      if (contentType != null && !contentType.isBlank()) {
        request.contentType(contentType);
      }
      if (attributes != null && !attributes.isEmpty()) {
        request.metadata(attributes);
      }

      s3Client.putObject(request.build(), RequestBody.fromBytes(data));

      LOGGER.info(
          "Uploaded object: bucket={}, key={}, size={} bytes", bucket, objectId, data.length);

    } catch (Exception e) {
      throw failure("upload", objectId, e);
    }
  }

  @Override
  public void delete(String objectId) {
    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(objectId).build());
      LOGGER.info("Deleted object: bucket={}, key={}", bucket, objectId);
    } catch (Exception e) {
      throw failure("delete", objectId, e);
    }
  }

  @Override
  public void copy(String sourceId, String targetId) {
    try {
      s3Client.copyObject(
          CopyObjectRequest.builder()
              .sourceBucket(bucket)
              .sourceKey(sourceId)
              .destinationBucket(bucket)
              .destinationKey(targetId)
              .build());
      LOGGER.info("Copied object: bucket={}, from={}, to={}", bucket, sourceId, targetId);
    } catch (Exception e) {
      throw failure("copy to " + targetId + " from", sourceId, e);
    }
  }

  @Override
  public void ping() {
    try {
      s3Client.listObjectsV2(ListObjectsV2Request.builder().bucket(bucket).maxKeys(1).build());
    } catch (Exception e) {
      throw failure("list", bucket, e);
    }
  }

  /**
   * Clean up resources when the client is no longer needed.
   *
   * <p>Called by the connection manager when it discards this client, and at shutdown.
   */
  @Override
  public void close() {
    LOGGER.info("Closing S3 client: bucket={}", bucket);
    s3Client.close();
  }

  /**
   * Map an SDK failure onto the error kinds the rest of the system understands.
   *
   * @param e the exception raised by the SDK
   * @return the classification
   */
  static ErrorKind classify(Exception e) {
    if (e instanceof ApiCallTimeoutException || e instanceof ApiCallAttemptTimeoutException) {
      return ErrorKind.TIMEOUT;
    }
    if (e instanceof NoSuchKeyException || e instanceof NoSuchBucketException) {
      return ErrorKind.NOT_FOUND;
    }
    if (e instanceof AwsServiceException serviceException) {
      String errorCode =
          serviceException.awsErrorDetails() != null
              ? serviceException.awsErrorDetails().errorCode()
              : null;
      if (errorCode != null && AUTH_EXPIRED_CODES.contains(errorCode)) {
        return ErrorKind.AUTH_EXPIRED;
      }
      int statusCode = serviceException.statusCode();
      if (statusCode == 404) {
        return ErrorKind.NOT_FOUND;
      }
      if (statusCode == 401) {
        return ErrorKind.AUTH_EXPIRED;
      }
      if (statusCode == 403) {
        return ErrorKind.PERMISSION_DENIED;
      }
      return ErrorKind.TRANSPORT;
    }
    if (e instanceof SdkClientException
        && e.getMessage() != null
        && e.getMessage().contains("Unable to load credentials")) {
      return ErrorKind.AUTH_EXPIRED;
    }
    return ErrorKind.TRANSPORT;
  }

  /**
   * Classify a failed HEAD request.
   *
   * <p>HEAD error responses have no body, so an expired session token arrives as a bare 400 with
   * no error code. That case is treated as expired credentials; if the store really meant a bad
   * request, the single retry after reset fails the same way and surfaces as unavailable.
   */
  static ErrorKind classifyHead(Exception e) {
    if (e instanceof AwsServiceException serviceException
        && serviceException.statusCode() == 400) {
      String errorCode =
          serviceException.awsErrorDetails() != null
              ? serviceException.awsErrorDetails().errorCode()
              : null;
      if (errorCode == null || errorCode.isBlank()) {
        return ErrorKind.AUTH_EXPIRED;
      }
    }
    return classify(e);
  }

  private static ObjectStoreException failure(String action, String objectId, Exception e) {
    return failure(action, objectId, e, classify(e));
  }

  private static ObjectStoreException failure(
      String action, String objectId, Exception e, ErrorKind kind) {
    if (kind == ErrorKind.NOT_FOUND) {
      // Object doesn't exist - this is not retryable
      String message = String.format("Object not found: key=%s", objectId);
      LOGGER.debug(message);
      return new ObjectStoreException(kind, message, e);
    }

    String statusCode =
        e instanceof AwsServiceException serviceException
            ? String.valueOf(serviceException.statusCode())
            : "n/a";
    String message =
        String.format(
            "Failed to %s object: key=%s, kind=%s, statusCode=%s",
            action,
            objectId,
            kind,
            statusCode);
    if (kind == ErrorKind.AUTH_EXPIRED) {
      LOGGER.warn(message);
    } else {
      LOGGER.error(message, e);
    }
    return new ObjectStoreException(kind, message, e);
  }

  private HeadObjectRequest headRequest(String objectId) {
    return HeadObjectRequest.builder().bucket(bucket).key(objectId).build();
  }
}
