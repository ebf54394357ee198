package com.scholary.audio.upload.catalog;

/**
 * Catalog collaborator that records assembled objects.
 *
 * <p>The assembler calls it only after the object is durable. A failure here never undoes the
 * object: the assembler falls back to {@link #updateParentRecord} and reports the degraded
 * outcome.
 */
public interface AssetRecorder {

  /**
   * Create the asset record.
   *
   * @throws CatalogException if the write fails
   */
  void recordAsset(AssetRecord record);

  /**
   * Best-effort update of the owning record.
   *
   * @throws CatalogException if the write fails
   */
  void updateParentRecord(ParentRecordUpdate update);
}
