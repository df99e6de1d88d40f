package com.scholary.mediacache.streaming;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.mediacache.cache.DiskChunkCache;
import com.scholary.mediacache.config.MediaCacheProperties;
import com.scholary.mediacache.connection.ObjectStoreConnectionManager;
import com.scholary.mediacache.metadata.MetadataCache;
import com.scholary.mediacache.metadata.MetadataRecord;
import com.scholary.mediacache.objectstore.ObjectStoreClient;
import com.scholary.mediacache.objectstore.ObjectStoreException;
import com.scholary.mediacache.objectstore.ObjectStoreException.ErrorKind;
import com.scholary.mediacache.range.ByteRangeResolver;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;

@ExtendWith(MockitoExtension.class)
class MediaStreamServiceTest {

  private static final String VIDEO = "video.mp4";
  private static final long FULL_BUFFER_THRESHOLD = 200;
  private static final int STREAMING_CHUNK = 100;

  @Mock private MetadataCache metadataCache;
  @Mock private ObjectStoreClient client;

  @TempDir Path cacheDir;

  private DiskChunkCache chunkCache;
  private MediaStreamService service;

  @BeforeEach
  void setUp() {
    MediaCacheProperties properties =
        new MediaCacheProperties(
            cacheDir.toString(),
            1024 * 1024,
            1000,
            20 * 1024 * 1024,
            10 * 1024 * 1024,
            FULL_BUFFER_THRESHOLD,
            STREAMING_CHUNK,
            "video/mp4",
            "public, max-age=3600",
            10);
    chunkCache =
        new DiskChunkCache(cacheDir, properties.chunkCacheBudgetBytes(), new ObjectMapper());
    service =
        new MediaStreamService(
            new ByteRangeResolver(
                properties.maxUnboundedRangeBytes(), properties.maxRangeChunkBytes()),
            metadataCache,
            chunkCache,
            new ObjectStoreConnectionManager(() -> client),
            properties);
  }

  @Test
  void serve_shouldFetchClampedRangeOnMissAndServeCacheOnHit() {
    givenObject(VIDEO, 1000, null);
    when(client.fetchRange(VIDEO, 0, 999)).thenReturn(content(1000));

    MediaResponse miss = service.serve(VIDEO, "bytes=0-1023");
    MediaResponse hit = service.serve(VIDEO, "bytes=0-1023");

    assertThat(miss.status()).isEqualTo(206);
    assertThat(miss.headers().getFirst(HttpHeaders.CONTENT_RANGE)).isEqualTo("bytes 0-999/1000");
    assertThat(miss.headers().getContentLength()).isEqualTo(1000);
    assertThat(miss.headers().getFirst("X-Cache")).isEqualTo("MISS");
    assertThat(hit.headers().getFirst("X-Cache")).isEqualTo("HIT");
    assertThat(hit.headers().getFirst(HttpHeaders.CONTENT_RANGE)).isEqualTo("bytes 0-999/1000");
    assertThat(((BufferedBody) hit.body()).bytes()).isEqualTo(content(1000));
    verify(client, times(1)).fetchRange(VIDEO, 0, 999);
  }

  @Test
  void serve_shouldResolveOpenEndedRangeToEndOfObject() {
    givenObject(VIDEO, 2000, null);
    when(client.fetchRange(VIDEO, 500, 1999)).thenReturn(content(1500));

    MediaResponse response = service.serve(VIDEO, "bytes=500-");

    assertThat(response.isPartial()).isTrue();
    assertThat(response.headers().getFirst(HttpHeaders.CONTENT_RANGE))
        .isEqualTo("bytes 500-1999/2000");
  }

  @Test
  void serve_shouldCarryStandardHeaders() {
    givenObject(VIDEO, 1000, "\"abc\"");
    when(client.fetchRange(VIDEO, 0, 9)).thenReturn(content(10));

    HttpHeaders headers = service.serve(VIDEO, "bytes=0-9").headers();

    assertThat(headers.getFirst(HttpHeaders.ACCEPT_RANGES)).isEqualTo("bytes");
    assertThat(headers.getFirst(HttpHeaders.CONTENT_TYPE)).isEqualTo("video/webm");
    assertThat(headers.getFirst(HttpHeaders.CACHE_CONTROL)).isEqualTo("public, max-age=3600");
    assertThat(headers.getETag()).isEqualTo("\"abc\"");
  }

  @Test
  void serve_shouldTolerateOneByteShortResponse() {
    givenObject(VIDEO, 1000, null);
    when(client.fetchRange(VIDEO, 0, 99)).thenReturn(content(99));

    MediaResponse response = service.serve(VIDEO, "bytes=0-99");

    assertThat(response.headers().getFirst(HttpHeaders.CONTENT_RANGE)).isEqualTo("bytes 0-98/1000");
    assertThat(response.headers().getContentLength()).isEqualTo(99);
    assertThat(service.serve(VIDEO, "bytes=0-99").headers().getFirst("X-Cache")).isEqualTo("HIT");
  }

  @Test
  void serve_shouldTrimOneByteLongResponse() {
    givenObject(VIDEO, 1000, null);
    when(client.fetchRange(VIDEO, 0, 99)).thenReturn(content(101));

    MediaResponse response = service.serve(VIDEO, "bytes=0-99");

    assertThat(((BufferedBody) response.body()).bytes()).isEqualTo(content(100));
    assertThat(response.headers().getFirst(HttpHeaders.CONTENT_RANGE)).isEqualTo("bytes 0-99/1000");
  }

  @Test
  void serve_shouldFailOnShortReadAndCacheNothing() {
    givenObject(VIDEO, 1000, null);
    when(client.fetchRange(VIDEO, 0, 99)).thenReturn(content(50));

    assertThatThrownBy(() -> service.serve(VIDEO, "bytes=0-99"))
        .isInstanceOf(ShortReadException.class)
        .hasMessageContaining("expected 100 bytes, got 50");
    assertThat(chunkCache.stats().items()).isZero();
  }

  @Test
  void serve_shouldFailWhenStoreReturnsTooMuch() {
    givenObject(VIDEO, 1000, null);
    when(client.fetchRange(VIDEO, 0, 99)).thenReturn(content(150));

    assertThatThrownBy(() -> service.serve(VIDEO, "bytes=0-99"))
        .isInstanceOf(ContentLengthMismatchException.class)
        .isNotInstanceOf(ShortReadException.class);
  }

  @Test
  void serve_shouldReportMissingObject() {
    when(metadataCache.get("nope.mp4")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.serve("nope.mp4", "bytes=0-1"))
        .isInstanceOf(ObjectNotFoundException.class);
    verify(client, never()).fetchRange(anyString(), anyLong(), anyLong());
  }

  @Test
  void serve_shouldTreatVanishedObjectAsNotFound() {
    givenObject(VIDEO, 1000, null);
    when(client.fetchRange(VIDEO, 0, 9))
        .thenThrow(new ObjectStoreException(ErrorKind.NOT_FOUND, "gone"));

    assertThatThrownBy(() -> service.serve(VIDEO, "bytes=0-9"))
        .isInstanceOf(ObjectNotFoundException.class);
    verify(metadataCache).invalidate(VIDEO);
  }

  @Test
  void serve_shouldFallBackToWholeObjectOnMalformedRange() {
    givenObject(VIDEO, 100, null);
    when(client.fetchFull(VIDEO)).thenReturn(content(100));

    MediaResponse response = service.serve(VIDEO, "bytes=garbage");

    assertThat(response.status()).isEqualTo(200);
    assertThat(response.headers().getFirst(HttpHeaders.CONTENT_RANGE)).isNull();
    assertThat(response.body().contentLength()).isEqualTo(100);
  }

  @Test
  void serve_shouldBufferSmallObjectWithoutRange() throws IOException {
    givenObject(VIDEO, 150, null);
    when(client.fetchFull(VIDEO)).thenReturn(content(150));

    MediaResponse response = service.serve(VIDEO, null);

    assertThat(response.status()).isEqualTo(200);
    assertThat(response.body()).isInstanceOf(BufferedBody.class);
    assertThat(response.headers().getFirst(HttpHeaders.ACCEPT_RANGES)).isEqualTo("bytes");
    assertThat(write(response.body())).isEqualTo(content(150));
    assertThat(chunkCache.stats().items()).isZero();
  }

  @Test
  void serve_shouldStreamLargeObjectInChunksWithoutCaching() throws IOException {
    givenObject(VIDEO, 250, null);
    byte[] whole = content(250);
    when(client.fetchRange(VIDEO, 0, 99)).thenReturn(Arrays.copyOfRange(whole, 0, 100));
    when(client.fetchRange(VIDEO, 100, 199)).thenReturn(Arrays.copyOfRange(whole, 100, 200));
    when(client.fetchRange(VIDEO, 200, 249)).thenReturn(Arrays.copyOfRange(whole, 200, 250));

    MediaResponse response = service.serve(VIDEO, null);

    assertThat(response.status()).isEqualTo(200);
    assertThat(response.headers().getContentLength()).isEqualTo(250);
    assertThat(response.body()).isInstanceOf(ChunkedRemoteBody.class);
    verify(client, never()).fetchRange(anyString(), anyLong(), anyLong());

    assertThat(write(response.body())).isEqualTo(whole);
    assertThat(chunkCache.stats().items()).isZero();
    verify(client, never()).fetchFull(VIDEO);
  }

  @Test
  void serve_shouldStopStreamingOnEmptyChunk() throws IOException {
    givenObject(VIDEO, 250, null);
    when(client.fetchRange(VIDEO, 0, 99)).thenReturn(content(100));
    when(client.fetchRange(VIDEO, 100, 199)).thenReturn(new byte[0]);

    byte[] written = write(service.serve(VIDEO, null).body());

    assertThat(written).hasSize(100);
    verify(client, never()).fetchRange(VIDEO, 200, 249);
  }

  @Test
  void serve_shouldStopFetchingWhenClientDisconnects() {
    givenObject(VIDEO, 250, null);
    when(client.fetchRange(VIDEO, 0, 99)).thenReturn(content(100));
    ResponseBody body = service.serve(VIDEO, null).body();

    OutputStream disconnected =
        new OutputStream() {
          @Override
          public void write(int b) throws IOException {
            throw new IOException("Broken pipe");
          }

          @Override
          public void write(byte[] b, int off, int len) throws IOException {
            throw new IOException("Broken pipe");
          }
        };

    assertThatThrownBy(() -> body.writeTo(disconnected)).isInstanceOf(IOException.class);
    assertThat(((ChunkedRemoteBody) body).hasNext()).isFalse();
    verify(client, times(1)).fetchRange(anyString(), anyLong(), anyLong());
  }

  @Test
  void serve_shouldAnswerZeroLengthObjectWithEmptyBody() {
    givenObject("empty.mp4", 0, null);

    MediaResponse response = service.serve("empty.mp4", "bytes=0-10");

    assertThat(response.status()).isEqualTo(200);
    assertThat(response.body().contentLength()).isZero();
    assertThat(response.headers().getContentLength()).isZero();
  }

  @Test
  void head_shouldReturnGetHeadersWithoutFetchingContent() {
    givenObject(VIDEO, 5000, "etag-1");

    MediaResponse response = service.head(VIDEO);

    assertThat(response.status()).isEqualTo(200);
    assertThat(response.headers().getContentLength()).isEqualTo(5000);
    assertThat(response.headers().getETag()).isEqualTo("\"etag-1\"");
    assertThat(response.headers().getFirst(HttpHeaders.ACCEPT_RANGES)).isEqualTo("bytes");
    assertThat(response.body().contentLength()).isZero();
    verify(client, never()).fetchFull(anyString());
  }

  @Test
  void onObjectChanged_shouldInvalidateBothCaches() {
    chunkCache.set(VIDEO, 0, 9, content(10));
    chunkCache.set("other.mp4", 0, 9, content(10));

    service.onObjectChanged(VIDEO);

    verify(metadataCache).invalidate(VIDEO);
    assertThat(chunkCache.peek(VIDEO, 0, 9)).isEmpty();
    assertThat(chunkCache.peek("other.mp4", 0, 9)).isPresent();
  }

  @Test
  void serve_shouldNotCacheBytesFetchedBeforeConcurrentChange() {
    givenObject(VIDEO, 1000, null);
    when(client.fetchRange(VIDEO, 0, 9))
        .thenAnswer(
            invocation -> {
              // an upload finishes while the old bytes are in flight
              service.onObjectChanged(VIDEO);
              return content(10);
            });

    MediaResponse response = service.serve(VIDEO, "bytes=0-9");

    assertThat(response.headers().getFirst("X-Cache")).isEqualTo("MISS");
    assertThat(((BufferedBody) response.body()).bytes()).isEqualTo(content(10));
    assertThat(chunkCache.peek(VIDEO, 0, 9)).isEmpty();
    assertThat(chunkCache.stats().items()).isZero();
  }

  @Test
  void serve_shouldCacheAgainOnceNoChangeIsInFlight() {
    givenObject(VIDEO, 1000, null);
    service.onObjectChanged(VIDEO);
    when(client.fetchRange(VIDEO, 0, 9)).thenReturn(content(10));

    service.serve(VIDEO, "bytes=0-9");

    assertThat(chunkCache.peek(VIDEO, 0, 9)).isPresent();
  }

  private void givenObject(String objectId, long size, String etag) {
    MetadataRecord record =
        new MetadataRecord(size, "video/webm", etag, Map.of(), Instant.now());
    when(metadataCache.get(objectId)).thenReturn(Optional.of(record));
  }

  private static byte[] write(ResponseBody body) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    body.writeTo(out);
    return out.toByteArray();
  }

  private static byte[] content(int size) {
    byte[] data = new byte[size];
    for (int i = 0; i < size; i++) {
      data[i] = (byte) (i % 251);
    }
    return data;
  }
}
