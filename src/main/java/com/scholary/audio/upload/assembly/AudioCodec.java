package com.scholary.audio.upload.assembly;

import java.util.Locale;

/** Codec family of an assembled audio object, guessed from content type and file extension. */
public enum AudioCodec {
  MP3("mp3"),
  AAC("aac"),
  OPUS("opus"),
  WAV("wav"),
  FLAC("flac"),
  UNKNOWN("unknown");

  private final String label;

  AudioCodec(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /**
   * Derive the codec from a MIME type and a file extension. Either may be null.
   *
   * <p>The first matching family wins, checked in the order mp3, aac, opus, wav, flac.
   */
  public static AudioCodec detect(String contentType, String extension) {
    String ct = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
    String ext = extension == null ? "" : extension.toLowerCase(Locale.ROOT);

    if (ct.contains("mp3") || ct.contains("mpeg") || ext.equals("mp3")) {
      return MP3;
    }
    if (ct.contains("mp4") || ct.contains("m4a") || ext.equals("m4a")) {
      return AAC;
    }
    if (ct.contains("ogg") || ct.contains("opus") || ext.equals("opus") || ext.equals("ogg")) {
      return OPUS;
    }
    if (ct.contains("wav") || ext.equals("wav")) {
      return WAV;
    }
    if (ct.contains("flac") || ext.equals("flac")) {
      return FLAC;
    }
    return UNKNOWN;
  }

  /** Extension of a key or file name, without the dot; empty if there is none. */
  public static String extensionOf(String name) {
    if (name == null) {
      return "";
    }
    int slash = name.lastIndexOf('/');
    int dot = name.lastIndexOf('.');
    return dot > slash && dot < name.length() - 1 ? name.substring(dot + 1) : "";
  }
}
