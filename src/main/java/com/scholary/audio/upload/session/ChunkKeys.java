package com.scholary.audio.upload.session;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Key scheme for temporary chunk objects.
 *
 * <p>Chunks live at {@code <tempPrefix>/<sessionId>/part_<4-digit part number>}. The zero padding
 * makes lexicographic key order equal to numeric part order, which is what the assembler relies
 * on after listing a session prefix.
 */
@Component
public final class ChunkKeys {

  /** Highest part number the 4-digit padding can order correctly. */
  public static final int MAX_PART_NUMBER = 9999;

  private static final Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");
  private static final Pattern PART_SUFFIX = Pattern.compile(".*/part_(\\d{4})$");

  private final String tempPrefix;

  public ChunkKeys(@Value("${upload.tempPrefix:_chunks}") String tempPrefix) {
    this.tempPrefix = stripSlashes(tempPrefix);
  }

  /** Prefix that every chunk of a session shares, ending in a slash. */
  public String sessionPrefix(String sessionId) {
    requireValidSessionId(sessionId);
    return tempPrefix + "/" + sessionId + "/";
  }

  public String chunkKey(String sessionId, int partNumber) {
    requireValidPartNumber(partNumber);
    return sessionPrefix(sessionId) + String.format("part_%04d", partNumber);
  }

  /**
   * Extract the part number embedded in a chunk key.
   *
   * @throws IllegalArgumentException if the key does not follow the chunk key scheme
   */
  public static int partNumberOf(String chunkKey) {
    Matcher matcher = PART_SUFFIX.matcher(chunkKey);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Not a chunk key: " + chunkKey);
    }
    return Integer.parseInt(matcher.group(1));
  }

  public static boolean isValidSessionId(String sessionId) {
    return sessionId != null && SESSION_ID.matcher(sessionId).matches();
  }

  public static void requireValidSessionId(String sessionId) {
    if (!isValidSessionId(sessionId)) {
      throw new IllegalArgumentException(
          "Invalid session id: must be 1-128 characters of letters, digits, '-' or '_'");
    }
  }

  public static void requireValidPartNumber(int partNumber) {
    if (partNumber < 1 || partNumber > MAX_PART_NUMBER) {
      throw new IllegalArgumentException(
          "Part number must be between 1 and " + MAX_PART_NUMBER + ", got " + partNumber);
    }
  }

  private static String stripSlashes(String prefix) {
    String stripped = prefix;
    while (stripped.startsWith("/")) {
      stripped = stripped.substring(1);
    }
    while (stripped.endsWith("/")) {
      stripped = stripped.substring(0, stripped.length() - 1);
    }
    if (stripped.isEmpty()) {
      throw new IllegalArgumentException("Chunk key prefix must not be empty");
    }
    return stripped;
  }
}
