package com.scholary.audio.upload.assembly;

import com.scholary.audio.upload.logging.StructuredLogger;
import com.scholary.audio.upload.objectstore.ObjectStoreClient;
import com.scholary.audio.upload.objectstore.ObjectStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Deletes temporary chunk objects without letting delete failures escape.
 *
 * <p>Orphaned chunks only cost storage, so a failed delete is logged and reported through a
 * {@link CleanupResult} while the assembly carries on.
 */
@Component
public class ChunkCleaner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkCleaner.class);

  private final ObjectStoreClient objectStoreClient;
  private final StructuredLogger structuredLogger;

  public ChunkCleaner(ObjectStoreClient objectStoreClient) {
    this.objectStoreClient = objectStoreClient;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  /** Delete one consumed chunk. */
  public CleanupResult deleteChunk(String bucket, String key) {
    try {
      objectStoreClient.deleteObject(bucket, key);
      return CleanupResult.success(key, 1);
    } catch (ObjectStoreException e) {
      structuredLogger.logCleanupFailed(key, e.getMessage());
      return CleanupResult.failed(key, e);
    }
  }

  /** Delete everything left under a session prefix. Deleting an already-empty prefix is a no-op. */
  public CleanupResult sweep(String bucket, String prefix) {
    try {
      int deleted = objectStoreClient.deletePrefix(bucket, prefix);
      LOGGER.debug("Swept session prefix: prefix={}, deleted={}", prefix, deleted);
      return CleanupResult.success(prefix, deleted);
    } catch (ObjectStoreException e) {
      structuredLogger.logCleanupFailed(prefix, e.getMessage());
      return CleanupResult.failed(prefix, e);
    }
  }
}
