package com.scholary.audio.upload.streaming;

import com.scholary.audio.upload.objectstore.ObjectStoreClient;
import com.scholary.audio.upload.objectstore.ObjectStoreException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Relays stored objects to playback clients with byte-range support.
 *
 * <p>The key is resolved to a short-lived presigned GET URL and fetched with the client's
 * {@code Range} header. Status, length, range and ETag are passed through; content type comes from
 * the key's extension. The body is streamed, never buffered whole.
 */
@Service
public class StreamingProxy {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamingProxy.class);

  // bytes=start-end, bytes=start- or bytes=-suffix
  private static final Pattern RANGE_PATTERN = Pattern.compile("bytes=(\\d*)-(\\d*)");

  private final ObjectStoreClient objectStoreClient;
  private final HttpClient httpClient;
  private final String bucket;
  private final StreamingProperties properties;

  public StreamingProxy(
      ObjectStoreClient objectStoreClient,
      HttpClient httpClient,
      @Value("${objectstore.bucket}") String bucket,
      StreamingProperties properties) {
    this.objectStoreClient = objectStoreClient;
    this.httpClient = httpClient;
    this.bucket = bucket;
    this.properties = properties;
  }

  /**
   * Open an object for streaming.
   *
   * @param key the object key
   * @param rangeHeader the client's Range header, or null
   * @return status, headers and body to relay
   * @throws ObjectStoreException if the object does not exist or the store fails
   * @throws IOException if the upstream request fails
   * @throws InterruptedException if interrupted while waiting for the upstream response
   */
  public StreamedObject open(String key, String rangeHeader)
      throws IOException, InterruptedException {
    requireValidKey(key);
    URL signedUrl = objectStoreClient.presignGet(bucket, key, properties.signedUrlTtl());

    HttpRequest.Builder request = HttpRequest.newBuilder().GET();
    try {
      request.uri(signedUrl.toURI());
    } catch (URISyntaxException e) {
      throw new ObjectStoreException("Presigned URL is not a valid URI for key " + key, e);
    }

    boolean rangeRequested = isSatisfiableSyntax(rangeHeader);
    if (rangeRequested) {
      request.header("Range", rangeHeader.trim());
    } else if (rangeHeader != null) {
      // Malformed ranges are ignored, as HTTP prescribes; the full object is served
      LOGGER.debug("Ignoring malformed Range header: key={}, range={}", key, rangeHeader);
    }

    HttpResponse<InputStream> response =
        httpClient.send(request.build(), HttpResponse.BodyHandlers.ofInputStream());
    int status = response.statusCode();

    if (status == 404) {
      response.body().close();
      throw ObjectStoreException.notFound("Object not found: key=" + key, null);
    }
    if (status != 200 && status != 206 && status != 416) {
      response.body().close();
      throw new ObjectStoreException(
          String.format("Upstream storage answered %d for key=%s", status, key));
    }

    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Accept-Ranges", "bytes");
    copyHeader(response, "Content-Range", headers);
    if (status == 416) {
      LOGGER.debug("Range not satisfiable: key={}, range={}", key, rangeHeader);
      return new StreamedObject(status, headers, response.body());
    }
    headers.put("Content-Type", MediaTypes.forKey(key));
    headers.put("Cache-Control", properties.cacheControl());
    copyHeader(response, "Content-Length", headers);
    copyHeader(response, "ETag", headers);

    LOGGER.debug(
        "Streaming object: key={}, status={}, range={}, length={}",
        key,
        status,
        rangeRequested ? rangeHeader : "full",
        headers.get("Content-Length"));
    return new StreamedObject(status, headers, response.body());
  }

  static boolean isSatisfiableSyntax(String rangeHeader) {
    if (rangeHeader == null) {
      return false;
    }
    var matcher = RANGE_PATTERN.matcher(rangeHeader.trim());
    return matcher.matches() && !(matcher.group(1).isEmpty() && matcher.group(2).isEmpty());
  }

  private static void requireValidKey(String key) {
    if (key == null || key.isBlank() || key.startsWith("/") || key.contains("..")) {
      throw new IllegalArgumentException("Invalid object key");
    }
  }

  private static void copyHeader(
      HttpResponse<?> response, String name, Map<String, String> target) {
    response.headers().firstValue(name).ifPresent(value -> target.put(name, value));
  }
}
