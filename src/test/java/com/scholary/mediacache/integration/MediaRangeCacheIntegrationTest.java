package com.scholary.mediacache.integration;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.UUID;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.HttpWaitStrategy;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * End-to-end test against a MinIO container.
 *
 * <p>Uploads objects straight into the bucket, then reads them back through the HTTP API: a range
 * that misses and then hits the chunk cache, a small object served whole, a large object streamed
 * in chunks, and an overwrite through the API that must not serve stale cached bytes.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
class MediaRangeCacheIntegrationTest {

  private static final String MINIO_ACCESS_KEY = "minioadmin";
  private static final String MINIO_SECRET_KEY = "minioadmin";
  private static final String TEST_BUCKET = "media-it";

  @Container
  static GenericContainer<?> minioContainer =
      new GenericContainer<>("minio/minio:RELEASE.2024-10-13T13-34-11Z")
          .withExposedPorts(9000)
          .withEnv("MINIO_ROOT_USER", MINIO_ACCESS_KEY)
          .withEnv("MINIO_ROOT_PASSWORD", MINIO_SECRET_KEY)
          .withCommand("server /data")
          .waitingFor(new HttpWaitStrategy().forPath("/minio/health/ready").forPort(9000));

  private static final Path CACHE_DIR =
      Path.of(System.getProperty("java.io.tmpdir"), "media-range-cache-it-" + UUID.randomUUID());

  private static S3Client s3Client;

  @Autowired private TestRestTemplate restTemplate;

  @DynamicPropertySource
  static void configureProperties(DynamicPropertyRegistry registry) {
    registry.add("objectstore.endpoint", MediaRangeCacheIntegrationTest::minioEndpoint);
    registry.add("objectstore.accessKey", () -> MINIO_ACCESS_KEY);
    registry.add("objectstore.secretKey", () -> MINIO_SECRET_KEY);
    registry.add("objectstore.bucket", () -> TEST_BUCKET);
    registry.add("objectstore.pathStyleAccess", () -> "true");
    registry.add("mediacache.chunkCacheDir", CACHE_DIR::toString);
    registry.add("mediacache.fullBufferThresholdBytes", () -> "4096");
    registry.add("mediacache.streamingChunkBytes", () -> "1000");
  }

  @BeforeAll
  static void createBucketAndObjects() {
    s3Client =
        S3Client.builder()
            .endpointOverride(URI.create(minioEndpoint()))
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(MINIO_ACCESS_KEY, MINIO_SECRET_KEY)))
            .forcePathStyle(true)
            .build();
    s3Client.createBucket(CreateBucketRequest.builder().bucket(TEST_BUCKET).build());
    put("small.mp4", content(1000, 0));
    put("large.mp4", content(10_000, 0));
  }

  @AfterAll
  static void closeClient() {
    if (s3Client != null) {
      s3Client.close();
    }
  }

  @Test
  void rangeRequest_shouldMissThenHitTheChunkCache() {
    ResponseEntity<byte[]> first = getRange("/api/stream/small.mp4", "bytes=0-1023");
    ResponseEntity<byte[]> second = getRange("/api/stream/small.mp4", "bytes=0-1023");

    assertThat(first.getStatusCode()).isEqualTo(HttpStatus.PARTIAL_CONTENT);
    assertThat(first.getHeaders().getFirst(HttpHeaders.CONTENT_RANGE))
        .isEqualTo("bytes 0-999/1000");
    assertThat(first.getHeaders().getFirst("X-Cache")).isEqualTo("MISS");
    assertThat(second.getHeaders().getFirst("X-Cache")).isEqualTo("HIT");
    assertThat(second.getBody()).isEqualTo(content(1000, 0));
  }

  @Test
  void plainRequest_shouldServeSmallObjectWhole() {
    ResponseEntity<byte[]> response =
        restTemplate.getForEntity("/api/stream/small.mp4", byte[].class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getFirst(HttpHeaders.ACCEPT_RANGES)).isEqualTo("bytes");
    assertThat(response.getBody()).isEqualTo(content(1000, 0));
  }

  @Test
  void plainRequest_shouldStreamLargeObjectInChunks() {
    ResponseEntity<byte[]> response =
        restTemplate.getForEntity("/api/stream/large.mp4", byte[].class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).isEqualTo(content(10_000, 0));
  }

  @Test
  void missingObject_shouldReturn404() {
    ResponseEntity<byte[]> response =
        restTemplate.getForEntity("/api/stream/does-not-exist.mp4", byte[].class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void uploadThroughApi_shouldInvalidateCachedRanges() {
    put("changing.mp4", content(500, 0));
    assertThat(getRange("/api/stream/changing.mp4", "bytes=0-99").getBody())
        .isEqualTo(Arrays.copyOf(content(500, 0), 100));

    HttpHeaders headers = new HttpHeaders();
    headers.set(HttpHeaders.CONTENT_TYPE, "video/mp4");
    ResponseEntity<String> upload =
        restTemplate.exchange(
            "/api/objects/changing.mp4",
            HttpMethod.PUT,
            new HttpEntity<>(content(500, 7), headers),
            String.class);
    assertThat(upload.getStatusCode()).isEqualTo(HttpStatus.OK);

    ResponseEntity<byte[]> after = getRange("/api/stream/changing.mp4", "bytes=0-99");
    assertThat(after.getHeaders().getFirst("X-Cache")).isEqualTo("MISS");
    assertThat(after.getBody()).isEqualTo(Arrays.copyOf(content(500, 7), 100));
  }

  @Test
  void fullHealth_shouldReportHealthyStore() {
    ResponseEntity<String> response = restTemplate.getForEntity("/api/health/full", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).contains("\"status\":\"healthy\"");
  }

  private ResponseEntity<byte[]> getRange(String path, String range) {
    HttpHeaders headers = new HttpHeaders();
    headers.set(HttpHeaders.RANGE, range);
    return restTemplate.exchange(path, HttpMethod.GET, new HttpEntity<>(headers), byte[].class);
  }

  private static void put(String key, byte[] data) {
    s3Client.putObject(
        PutObjectRequest.builder().bucket(TEST_BUCKET).key(key).contentType("video/mp4").build(),
        RequestBody.fromBytes(data));
  }

  private static String minioEndpoint() {
    return String.format(
        "http://%s:%d", minioContainer.getHost(), minioContainer.getMappedPort(9000));
  }

  private static byte[] content(int size, int seed) {
    byte[] data = new byte[size];
    for (int i = 0; i < size; i++) {
      data[i] = (byte) ((i + seed) % 251);
    }
    return data;
  }
}
