package com.scholary.audio.upload.assembly;

/** No chunk objects exist for the session: it expired or never started. */
public class NoChunksFoundException extends AssemblyException {

  public NoChunksFoundException(String sessionId) {
    super(
        sessionId,
        "No chunks found for session " + sessionId + ". Upload may have expired, please restart it.",
        false);
  }

  @Override
  public String getErrorCode() {
    return "NoChunksFound";
  }
}
