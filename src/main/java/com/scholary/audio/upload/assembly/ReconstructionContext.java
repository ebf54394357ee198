package com.scholary.audio.upload.assembly;

import java.util.List;

/**
 * Input of a reconstruction strategy.
 *
 * @param sessionId the session being assembled
 * @param bucket bucket holding both chunks and target
 * @param targetKey key of the object to produce
 * @param contentType MIME type of the object to produce
 * @param chunkKeys chunk keys in part order; never empty
 * @param deadline deadline of the surrounding assembly call
 */
public record ReconstructionContext(
    String sessionId,
    String bucket,
    String targetKey,
    String contentType,
    List<String> chunkKeys,
    Deadline deadline) {

  public ReconstructionContext {
    if (chunkKeys == null || chunkKeys.isEmpty()) {
      throw new IllegalArgumentException("At least one chunk key is required");
    }
    chunkKeys = List.copyOf(chunkKeys);
  }
}
