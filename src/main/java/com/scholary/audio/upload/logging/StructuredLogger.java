package com.scholary.audio.upload.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log upload events with structured fields that can be queried in a log search backend.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log chunk stored event. */
  public void logChunkReceived(String sessionId, int partNumber, long size) {
    try {
      MDC.put("event_type", "chunk_received");
      MDC.put("partNumber", String.valueOf(partNumber));
      MDC.put("size", String.valueOf(size));

      logger.debug(
          "Chunk received: sessionId={}, part={}, size={}", sessionId, partNumber, size);
    } finally {
      clearEventFields();
    }
  }

  /** Log assembly start with the strategy that was selected. */
  public void logAssemblyStarted(
      String sessionId, int chunkCount, long estimatedSize, String strategy) {
    try {
      MDC.put("event_type", "assembly_started");
      MDC.put("chunkCount", String.valueOf(chunkCount));
      MDC.put("estimatedSize", String.valueOf(estimatedSize));
      MDC.put("strategy", strategy);

      logger.info(
          "Assembly started: sessionId={}, chunks={}, estimatedSize={}, strategy={}",
          sessionId,
          chunkCount,
          estimatedSize,
          strategy);
    } finally {
      clearEventFields();
    }
  }

  /** Log one multipart part upload. */
  public void logPartUploaded(String uploadId, int partNumber, long size, long bufferHighWater) {
    try {
      MDC.put("event_type", "part_uploaded");
      MDC.put("uploadId", uploadId);
      MDC.put("partNumber", String.valueOf(partNumber));
      MDC.put("size", String.valueOf(size));
      MDC.put("bufferHighWater", String.valueOf(bufferHighWater));

      logger.debug(
          "Part uploaded: uploadId={}, part={}, size={}, bufferHighWater={}",
          uploadId,
          partNumber,
          size,
          bufferHighWater);
    } finally {
      clearEventFields();
    }
  }

  /** Log assembly success. */
  public void logAssemblyCompleted(
      String sessionId, String finalKey, long byteSize, String strategy, long elapsedMs) {
    try {
      MDC.put("event_type", "assembly_completed");
      MDC.put("finalKey", finalKey);
      MDC.put("size", String.valueOf(byteSize));
      MDC.put("strategy", strategy);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Assembly completed: sessionId={}, key={}, size={}, strategy={}, elapsed={}ms",
          sessionId,
          finalKey,
          byteSize,
          strategy,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log assembly failure. */
  public void logAssemblyFailed(String sessionId, String errorCode, String message) {
    try {
      MDC.put("event_type", "assembly_failed");
      MDC.put("errorType", errorCode);

      logger.error(
          "Assembly failed: sessionId={}, error={}, message={}", sessionId, errorCode, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a cleanup call that did not fully succeed. */
  public void logCleanupFailed(String target, String message) {
    try {
      MDC.put("event_type", "cleanup_failed");
      MDC.put("cleanupTarget", target);

      logger.warn("Cleanup failed: target={}, message={}", target, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a catalog write that fell back to the degraded path. */
  public void logCatalogFallback(String finalKey, boolean fallbackSucceeded, String message) {
    try {
      MDC.put("event_type", "catalog_fallback");
      MDC.put("finalKey", finalKey);
      MDC.put("fallbackSucceeded", String.valueOf(fallbackSucceeded));

      logger.warn(
          "Catalog record failed, fallback {}: key={}, message={}",
          fallbackSucceeded ? "applied" : "failed",
          finalKey,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Set upload session context in MDC. */
  public static void setSessionContext(String sessionId, String bucket) {
    MDC.put("sessionId", sessionId);
    MDC.put("bucket", bucket);
  }

  /** Clear upload session context from MDC. */
  public static void clearSessionContext() {
    MDC.remove("sessionId");
    MDC.remove("bucket");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("partNumber");
    MDC.remove("size");
    MDC.remove("chunkCount");
    MDC.remove("estimatedSize");
    MDC.remove("strategy");
    MDC.remove("uploadId");
    MDC.remove("bufferHighWater");
    MDC.remove("finalKey");
    MDC.remove("elapsedMs");
    MDC.remove("errorType");
    MDC.remove("cleanupTarget");
    MDC.remove("fallbackSucceeded");
  }
}
