package com.scholary.audio.upload.assembly;

/**
 * Strategy for rebuilding one object from ordered chunk objects.
 *
 * <p>Implementations share one contract:
 *
 * <ul>
 *   <li>On return, the target object exists and its bytes equal the chunks concatenated in the
 *       given order.
 *   <li>On throw, no object has been committed at the target key and no multipart upload is left
 *       open.
 * </ul>
 *
 * <p>Implementations may delete chunk objects they have consumed. Sweeping what is left is the
 * caller's job.
 */
public interface ReconstructionStrategy {

  /**
   * Rebuild the target object.
   *
   * @param context the chunks, target and deadline
   * @return what was written
   * @throws com.scholary.audio.upload.objectstore.ObjectStoreException if a store call fails
   * @throws AssemblyTimeoutException if the deadline passes
   */
  ReconstructionOutcome reconstruct(ReconstructionContext context);

  /**
   * Get the strategy name for logging and debugging.
   *
   * @return strategy name
   */
  String getStrategyName();

  /**
   * Whether the strategy deletes chunks while it runs. If it does, a failed run leaves the
   * session unrecoverable and the assembler sweeps the rest.
   */
  default boolean consumesChunks() {
    return false;
  }
}
