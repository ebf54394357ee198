package com.scholary.audio.upload.assembly;

import com.scholary.audio.upload.catalog.AssetRecord;
import com.scholary.audio.upload.catalog.AssetRecorder;
import com.scholary.audio.upload.catalog.ParentRecordUpdate;
import com.scholary.audio.upload.logging.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Records a stored audio object in the catalog.
 *
 * <p>Called only once the object is durable. When the asset record cannot be written, the owning
 * record is pointed at the object instead; neither failure undoes the object.
 */
@Component
public class AssetCataloger {

  private static final Logger LOGGER = LoggerFactory.getLogger(AssetCataloger.class);

  private final AssetRecorder assetRecorder;
  private final FinalKeys finalKeys;
  private final StructuredLogger structuredLogger;

  public AssetCataloger(AssetRecorder assetRecorder, FinalKeys finalKeys) {
    this.assetRecorder = assetRecorder;
    this.finalKeys = finalKeys;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  /**
   * Record the object for its owner.
   *
   * @return true if the asset record was written, false if only the fallback ran
   */
  public boolean record(
      String ownerId, String originalName, int sortOrder, AssembledObject object, String publicUrl) {
    AssetRecord record =
        new AssetRecord(
            ownerId,
            object.finalKey(),
            publicUrl,
            originalName,
            object.byteSize(),
            object.codec().label(),
            sortOrder);
    try {
      assetRecorder.recordAsset(record);
      return true;
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to record asset: key={}", object.finalKey(), e);
    }

    boolean fallbackApplied = false;
    try {
      assetRecorder.updateParentRecord(
          new ParentRecordUpdate(
              ownerId,
              publicUrl,
              originalKey(ownerId, originalName, sortOrder),
              object.byteSize(),
              object.codec().label()));
      fallbackApplied = true;
    } catch (RuntimeException e) {
      LOGGER.error("Fallback parent record update failed: owner={}", ownerId, e);
    }
    structuredLogger.logCatalogFallback(
        object.finalKey(), fallbackApplied, "asset record write failed");
    return false;
  }

  /** Key stored as the owner's original file. */
  public String originalKey(String ownerId, String originalName, int sortOrder) {
    return finalKeys.originalKey(ownerId, sortOrder + "_" + originalName);
  }
}
