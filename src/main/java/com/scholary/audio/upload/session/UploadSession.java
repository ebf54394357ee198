package com.scholary.audio.upload.session;

/**
 * One in-flight reconstruction, as described by the caller that completes it.
 *
 * <p>There is no stored session record: the only state is the set of chunk objects under the
 * session's key prefix.
 *
 * @param sessionId caller-generated id scoping the chunk key namespace
 * @param expectedParts number of chunks the caller sent, or null to accept whatever is listed
 * @param targetKey key of the object to produce
 * @param contentType MIME type of the object to produce
 * @param declaredSize total size declared by the caller, or null if unknown
 */
public record UploadSession(
    String sessionId,
    Integer expectedParts,
    String targetKey,
    String contentType,
    Long declaredSize) {

  public UploadSession {
    ChunkKeys.requireValidSessionId(sessionId);
    if (expectedParts != null && expectedParts < 1) {
      throw new IllegalArgumentException("Expected parts must be positive");
    }
    if (targetKey == null || targetKey.isBlank()) {
      throw new IllegalArgumentException("Target key must not be blank");
    }
    if (contentType == null || contentType.isBlank()) {
      throw new IllegalArgumentException("Content type must not be blank");
    }
    if (declaredSize != null && declaredSize < 0) {
      throw new IllegalArgumentException("Declared size must not be negative");
    }
  }
}
