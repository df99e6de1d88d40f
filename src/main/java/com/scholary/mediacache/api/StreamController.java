package com.scholary.mediacache.api;

import com.scholary.mediacache.connection.RemoteUnavailableException;
import com.scholary.mediacache.logging.StructuredLogger;
import com.scholary.mediacache.streaming.ContentLengthMismatchException;
import com.scholary.mediacache.streaming.MediaResponse;
import com.scholary.mediacache.streaming.MediaStreamService;
import com.scholary.mediacache.streaming.ObjectNotFoundException;
import com.scholary.mediacache.streaming.ResponseBody;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * REST API for serving media objects and byte ranges of them.
 *
 * <p>The object id is everything after {@code /api/stream/}, slashes included.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Streaming", description = "Range-aware media streaming")
public class StreamController {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamController.class);

  private final MediaStreamService streamService;

  public StreamController(MediaStreamService streamService) {
    this.streamService = streamService;
  }

  /**
   * Serve an object, or the requested byte range of it.
   *
   * <p>Small objects are returned in one piece. Large objects are streamed in chunks as the client
   * reads them; if the client disconnects, no further chunks are fetched.
   */
  @GetMapping("/stream/{*objectPath}")
  @Operation(
      summary = "Stream an object",
      description =
          "Returns 206 with Content-Range for a Range request and 200 for the whole object. "
              + "A malformed Range header is ignored and the whole object is returned.")
  public ResponseEntity<StreamingResponseBody> stream(
      @PathVariable String objectPath,
      @RequestHeader(value = HttpHeaders.RANGE, required = false) String range) {
    String objectId = ObjectPaths.toObjectId(objectPath);
    if (objectId == null) {
      return ResponseEntity.badRequest().build();
    }

    String requestId = UUID.randomUUID().toString();
    try {
      StructuredLogger.setRequestContext(requestId, objectId);
      LOGGER.info("Stream request: objectId={}, range={}", objectId, range);

      MediaResponse response = streamService.serve(objectId, range);
      StreamingResponseBody body = writer(requestId, objectId, response.body());
      return ResponseEntity.status(response.status()).headers(response.headers()).body(body);

    } catch (ObjectNotFoundException e) {
      LOGGER.info("Object not found: {}", objectId);
      return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
    } catch (RemoteUnavailableException e) {
      LOGGER.error("Object store unavailable while serving {}: {}", objectId, e.getMessage());
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    } catch (ContentLengthMismatchException e) {
      LOGGER.error("Bad response from object store: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.BAD_GATEWAY).build();
    } catch (RuntimeException e) {
      LOGGER.error("Failed to serve {}", objectId, e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  /** Same headers as a GET without a Range header, no body. */
  @RequestMapping(value = "/stream/{*objectPath}", method = RequestMethod.HEAD)
  @Operation(summary = "Object headers", description = "Size, type and ETag without the content")
  public ResponseEntity<Void> head(@PathVariable String objectPath) {
    String objectId = ObjectPaths.toObjectId(objectPath);
    if (objectId == null) {
      return ResponseEntity.badRequest().build();
    }

    try {
      StructuredLogger.setRequestContext(UUID.randomUUID().toString(), objectId);
      MediaResponse response = streamService.head(objectId);
      return ResponseEntity.status(response.status()).headers(response.headers()).build();

    } catch (ObjectNotFoundException e) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
    } catch (RemoteUnavailableException e) {
      LOGGER.error("Object store unavailable for HEAD {}: {}", objectId, e.getMessage());
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    } catch (RuntimeException e) {
      LOGGER.error("Failed HEAD for {}", objectId, e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  /** The body is written on an async thread, so the request context is set again there. */
  private static StreamingResponseBody writer(
      String requestId, String objectId, ResponseBody body) {
    return out -> {
      StructuredLogger.setRequestContext(requestId, objectId);
      try {
        body.writeTo(out);
      } catch (IOException e) {
        body.cancel();
        throw e;
      } finally {
        StructuredLogger.clearRequestContext();
      }
    };
  }
}
