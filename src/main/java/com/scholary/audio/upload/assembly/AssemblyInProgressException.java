package com.scholary.audio.upload.assembly;

/** Another assembly call currently holds the lease for the same session. */
public class AssemblyInProgressException extends AssemblyException {

  public AssemblyInProgressException(String sessionId) {
    super(sessionId, "Assembly already in progress for session " + sessionId, true);
  }

  @Override
  public String getErrorCode() {
    return "AssemblyInProgress";
  }
}
