package com.scholary.audio.upload.assembly;

import java.time.Duration;

/** The assembly ran past its deadline and was rolled back. */
public class AssemblyTimeoutException extends AssemblyException {

  public AssemblyTimeoutException(String sessionId, Duration timeout, String stage) {
    this(
        sessionId,
        String.format(
            "Assembly of session %s exceeded its %ds deadline during %s",
            sessionId, timeout.toSeconds(), stage),
        true);
  }

  private AssemblyTimeoutException(String sessionId, String message, boolean retryable) {
    super(sessionId, message, retryable);
  }

  /** Same timeout, reported after the chunks were consumed so a retry cannot succeed. */
  public AssemblyTimeoutException restartRequired() {
    AssemblyTimeoutException copy = new AssemblyTimeoutException(getSessionId(), getMessage(), false);
    copy.setStackTrace(getStackTrace());
    for (Throwable suppressed : getSuppressed()) {
      copy.addSuppressed(suppressed);
    }
    return copy;
  }

  @Override
  public String getErrorCode() {
    return "AssemblyTimeout";
  }
}
