package com.scholary.audio.upload.streaming;

import java.util.Locale;
import java.util.Map;

/** Content type of a stored object, inferred from the extension of its key. */
public final class MediaTypes {

  static final String DEFAULT = "application/octet-stream";

  private static final Map<String, String> BY_EXTENSION =
      Map.ofEntries(
          Map.entry("mp3", "audio/mpeg"),
          Map.entry("m4a", "audio/mp4"),
          Map.entry("mp4", "audio/mp4"),
          Map.entry("aac", "audio/aac"),
          Map.entry("ogg", "audio/ogg"),
          Map.entry("oga", "audio/ogg"),
          Map.entry("opus", "audio/ogg"),
          Map.entry("wav", "audio/wav"),
          Map.entry("flac", "audio/flac"),
          Map.entry("webm", "audio/webm"),
          Map.entry("jpg", "image/jpeg"),
          Map.entry("jpeg", "image/jpeg"),
          Map.entry("png", "image/png"),
          Map.entry("webp", "image/webp"));

  private MediaTypes() {}

  public static String forKey(String key) {
    int dot = key.lastIndexOf('.');
    if (dot < 0 || dot < key.lastIndexOf('/')) {
      return DEFAULT;
    }
    String ext = key.substring(dot + 1).toLowerCase(Locale.ROOT);
    return BY_EXTENSION.getOrDefault(ext, DEFAULT);
  }
}
