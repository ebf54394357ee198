package com.scholary.audio.upload.api;

import com.scholary.audio.upload.streaming.StreamedObject;
import com.scholary.audio.upload.streaming.StreamingProxy;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * Range-capable read endpoint for assembled audio.
 *
 * <p>The whole remaining path is the object key, so keys with slashes map directly onto URLs.
 */
@RestController
@Tag(name = "Streaming", description = "Byte-range audio streaming")
public class AudioStreamController {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioStreamController.class);

  private final StreamingProxy streamingProxy;

  public AudioStreamController(StreamingProxy streamingProxy) {
    this.streamingProxy = streamingProxy;
  }

  @GetMapping("/api/audio/stream/{*fileKey}")
  @Operation(
      summary = "Stream audio",
      description = "Relay a stored object, honoring Range requests with 206 Partial Content")
  public ResponseEntity<StreamingResponseBody> stream(
      @PathVariable String fileKey,
      @RequestHeader(value = HttpHeaders.RANGE, required = false) String range)
      throws IOException {
    String key = fileKey.startsWith("/") ? fileKey.substring(1) : fileKey;

    StreamedObject object;
    try {
      object = streamingProxy.open(key, range);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while opening stream: key={}", key);
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }

    ResponseEntity.BodyBuilder response = ResponseEntity.status(object.status());
    object.headers().forEach((name, value) -> response.header(name, value));

    InputStream upstream = object.body();
    if (object.status() == HttpStatus.REQUESTED_RANGE_NOT_SATISFIABLE.value()) {
      upstream.close();
      return response.build();
    }

    StreamingResponseBody body =
        out -> {
          try (InputStream in = upstream) {
            in.transferTo(out);
          }
        };
    return response.body(body);
  }
}
