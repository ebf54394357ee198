package com.scholary.audio.upload.assembly;

/**
 * A chunk store call failed during assembly.
 *
 * <p>All writes are idempotent by key, so the assembly call can be retried as long as the chunks
 * are still in place. When the failing strategy had already consumed chunks the error is marked
 * as not retryable.
 */
public class StorageFailureException extends AssemblyException {

  public StorageFailureException(
      String sessionId, String message, Throwable cause, boolean retryable) {
    super(sessionId, message, cause, retryable);
  }

  @Override
  public String getErrorCode() {
    return "StorageFailure";
  }
}
