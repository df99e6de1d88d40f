package com.scholary.mediacache.api;

import com.scholary.mediacache.connection.RemoteUnavailableException;
import com.scholary.mediacache.mutation.ObjectMutationService;
import com.scholary.mediacache.objectstore.ObjectStoreException;
import com.scholary.mediacache.objectstore.ObjectStoreException.ErrorKind;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for changing objects.
 *
 * <p>Every change goes through {@link ObjectMutationService}, which invalidates the caches.
 * Headers named {@code X-Object-Meta-<name>} on an upload become custom attributes.
 */
@RestController
@RequestMapping("/api/objects")
@Tag(name = "Objects", description = "Upload, delete and rename objects")
public class ObjectController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectController.class);

  static final String ATTRIBUTE_HEADER_PREFIX = "x-object-meta-";

  private final ObjectMutationService mutationService;

  public ObjectController(ObjectMutationService mutationService) {
    this.mutationService = mutationService;
  }

  @PutMapping("/{*objectPath}")
  @Operation(summary = "Upload an object", description = "Stores the request body under the key")
  public ResponseEntity<MutationResponse> upload(
      @PathVariable String objectPath,
      @RequestBody byte[] content,
      @RequestHeader HttpHeaders headers) {
    String objectId = ObjectPaths.toObjectId(objectPath);
    if (objectId == null) {
      return ResponseEntity.badRequest().build();
    }

    String contentType =
        headers.getContentType() == null ? null : headers.getContentType().toString();
    return run(
        () -> mutationService.upload(objectId, content, contentType, attributes(headers)),
        MutationResponse.of("uploaded", objectId));
  }

  @DeleteMapping("/{*objectPath}")
  @Operation(summary = "Delete an object")
  public ResponseEntity<MutationResponse> delete(@PathVariable String objectPath) {
    String objectId = ObjectPaths.toObjectId(objectPath);
    if (objectId == null) {
      return ResponseEntity.badRequest().build();
    }
    return run(() -> mutationService.delete(objectId), MutationResponse.of("deleted", objectId));
  }

  @PostMapping("/rename")
  @Operation(summary = "Rename an object", description = "Server-side copy, then delete")
  public ResponseEntity<MutationResponse> rename(@Valid @RequestBody RenameRequest request) {
    return run(
        () -> mutationService.rename(request.from(), request.to()),
        new MutationResponse("renamed", request.to(), request.from()));
  }

  private ResponseEntity<MutationResponse> run(Runnable mutation, MutationResponse result) {
    try {
      mutation.run();
      return ResponseEntity.ok(result);

    } catch (IllegalArgumentException e) {
      LOGGER.warn("Rejected {}: {}", result.action(), e.getMessage());
      return ResponseEntity.badRequest().build();
    } catch (ObjectStoreException e) {
      if (e.getKind() == ErrorKind.NOT_FOUND) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
      }
      LOGGER.error(
          "Object store refused {} of {}: {}", result.action(), result.objectId(), e.getMessage());
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    } catch (RemoteUnavailableException e) {
      LOGGER.error("Object store unavailable for {}: {}", result.action(), e.getMessage());
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }
  }

  private static Map<String, String> attributes(HttpHeaders headers) {
    Map<String, String> attributes = new TreeMap<>();
    headers.forEach(
        (name, values) -> {
          String lower = name.toLowerCase(Locale.ROOT);
          if (lower.startsWith(ATTRIBUTE_HEADER_PREFIX) && !values.isEmpty()) {
            attributes.put(lower.substring(ATTRIBUTE_HEADER_PREFIX.length()), values.get(0));
          }
        });
    return attributes;
  }
}
