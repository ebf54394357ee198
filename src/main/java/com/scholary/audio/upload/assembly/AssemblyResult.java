package com.scholary.audio.upload.assembly;

/**
 * Outcome of a successful assembly.
 *
 * @param object the assembled object
 * @param publicUrl playback URL for the object
 * @param catalogRecorded false when the asset record write failed and the degraded fallback ran;
 *     the object itself is durable either way
 * @param chunkCleanup result of sweeping the session's chunks after the object was written
 */
public record AssemblyResult(
    AssembledObject object,
    String publicUrl,
    boolean catalogRecorded,
    CleanupResult chunkCleanup) {

  /** False when chunk objects may be left under the session prefix. */
  public boolean cleanupComplete() {
    return chunkCleanup.isSuccess();
  }
}
