package com.scholary.audio.upload.assembly;

/**
 * The number of listed chunks differs from the number the caller says it sent.
 *
 * <p>Missing chunks cannot be resent individually; the client has to restart the upload.
 */
public class PartCountMismatchException extends AssemblyException {

  private final int expected;
  private final int found;

  public PartCountMismatchException(String sessionId, int expected, int found) {
    super(
        sessionId,
        String.format(
            "Expected %d chunks but found %d for session %s. Please restart the upload.",
            expected, found, sessionId),
        false);
    this.expected = expected;
    this.found = found;
  }

  public int getExpected() {
    return expected;
  }

  public int getFound() {
    return found;
  }

  @Override
  public String getErrorCode() {
    return "PartCountMismatch";
  }
}
