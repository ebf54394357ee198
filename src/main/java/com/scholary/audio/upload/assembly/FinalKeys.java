package com.scholary.audio.upload.assembly;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

/**
 * Key scheme of assembled objects and their playback URLs.
 *
 * <p>Final objects live at {@code <domainPrefix>/<ownerId>/<sortOrder>_<epochMillis>.<ext>}. The
 * timestamp keeps re-uploads for the same owner and position from overwriting each other.
 */
@Component
public class FinalKeys {

  static final String STREAM_PATH = "/api/audio/stream/";

  private static final String DEFAULT_AUDIO_EXTENSION = "mp3";
  private static final String DEFAULT_ORIGINAL_EXTENSION = "bin";

  private final String domainPrefix;
  private final Clock clock;

  public FinalKeys(@Value("${upload.domainPrefix:audio}") String domainPrefix, Clock clock) {
    this.domainPrefix = domainPrefix;
    this.clock = clock;
  }

  public String finalKey(String ownerId, int sortOrder, String fileName) {
    requireValidOwnerId(ownerId);
    String ext = AudioCodec.extensionOf(fileName);
    if (ext.isEmpty()) {
      ext = DEFAULT_AUDIO_EXTENSION;
    }
    return String.format("%s/%s/%d_%d.%s", domainPrefix, ownerId, sortOrder, clock.millis(), ext);
  }

  /** Key recorded as the owner's original file when only the parent record can be updated. */
  public String originalKey(String ownerId, String originalName) {
    requireValidOwnerId(ownerId);
    String ext = AudioCodec.extensionOf(originalName);
    if (ext.isEmpty()) {
      ext = DEFAULT_ORIGINAL_EXTENSION;
    }
    return String.format("originals/%s/original.%s", ownerId, ext);
  }

  /** Playback URL: the streaming endpoint followed by the path-encoded key. */
  public static String publicUrl(String key) {
    return STREAM_PATH + UriUtils.encodePath(key, StandardCharsets.UTF_8);
  }

  private static void requireValidOwnerId(String ownerId) {
    if (ownerId == null || ownerId.isBlank() || ownerId.contains("/")) {
      throw new IllegalArgumentException("Owner id must be non-blank and must not contain '/'");
    }
  }
}
