package com.scholary.audio.upload.assembly;

/**
 * Base class of the typed errors an assembly call can end with.
 *
 * <p>Each subclass carries a stable error code for API clients and tells them whether retrying
 * the assembly call is safe or the whole upload must be restarted.
 */
public abstract class AssemblyException extends RuntimeException {

  private final String sessionId;
  private final boolean retryable;

  protected AssemblyException(String sessionId, String message, boolean retryable) {
    super(message);
    this.sessionId = sessionId;
    this.retryable = retryable;
  }

  protected AssemblyException(
      String sessionId, String message, Throwable cause, boolean retryable) {
    super(message, cause);
    this.sessionId = sessionId;
    this.retryable = retryable;
  }

  public String getSessionId() {
    return sessionId;
  }

  /** Stable machine-readable code, e.g. {@code PartCountMismatch}. */
  public abstract String getErrorCode();

  /**
   * True when the caller may repeat the assembly call as is. False means the chunks are gone or
   * unusable and the upload must start over.
   */
  public boolean isRetryable() {
    return retryable;
  }
}
