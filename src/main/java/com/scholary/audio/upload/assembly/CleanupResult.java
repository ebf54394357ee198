package com.scholary.audio.upload.assembly;

import java.util.Optional;

/**
 * Result of a best-effort cleanup call.
 *
 * <p>Cleanup failures never change the outcome of an assembly; they are returned here so callers
 * can log or count them instead of losing them in a catch block.
 *
 * @param target the key or prefix that was cleaned up
 * @param deleted number of objects deleted
 * @param failure the error, if the call failed
 */
public record CleanupResult(String target, int deleted, Optional<Exception> failure) {

  public static CleanupResult success(String target, int deleted) {
    return new CleanupResult(target, deleted, Optional.empty());
  }

  public static CleanupResult failed(String target, Exception failure) {
    return new CleanupResult(target, 0, Optional.of(failure));
  }

  public boolean isSuccess() {
    return failure.isEmpty();
  }
}
