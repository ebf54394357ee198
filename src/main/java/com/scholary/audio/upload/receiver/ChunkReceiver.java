package com.scholary.audio.upload.receiver;

import com.scholary.audio.upload.logging.StructuredLogger;
import com.scholary.audio.upload.objectstore.ObjectStoreClient;
import com.scholary.audio.upload.session.ChunkKeys;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Stores uploaded chunks as temporary objects.
 *
 * <p>Each call writes exactly one object at the session's chunk key for the given part number.
 * Nothing is checked about ordering or completeness here; that is left to the assembler, so the
 * receiver keeps no state and any instance can take any chunk. Re-sending a part overwrites the
 * previous object at that key.
 */
@Service
public class ChunkReceiver {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkReceiver.class);
  private static final String CHUNK_CONTENT_TYPE = "application/octet-stream";

  private final ObjectStoreClient objectStoreClient;
  private final ChunkKeys chunkKeys;
  private final String bucket;
  private final StructuredLogger structuredLogger;

  public ChunkReceiver(
      ObjectStoreClient objectStoreClient,
      ChunkKeys chunkKeys,
      @Value("${objectstore.bucket}") String bucket) {
    this.objectStoreClient = objectStoreClient;
    this.chunkKeys = chunkKeys;
    this.bucket = bucket;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  /**
   * Store one chunk.
   *
   * @param sessionId the upload session
   * @param partNumber 1-based part number
   * @param bytes the chunk payload
   * @return the stored part number and size
   * @throws IllegalArgumentException if the session id or part number is invalid
   * @throws com.scholary.audio.upload.objectstore.ObjectStoreException if the write fails
   */
  public ChunkReceipt receive(String sessionId, int partNumber, byte[] bytes) {
    if (bytes == null) {
      throw new IllegalArgumentException("Chunk payload is required");
    }
    String key = chunkKeys.chunkKey(sessionId, partNumber);

    objectStoreClient.putObject(bucket, key, bytes, CHUNK_CONTENT_TYPE);

    structuredLogger.logChunkReceived(sessionId, partNumber, bytes.length);
    return new ChunkReceipt(partNumber, bytes.length);
  }

  /**
   * Store one chunk read from a stream of known length.
   *
   * @throws IOException if reading the stream fails
   */
  public ChunkReceipt receive(String sessionId, int partNumber, InputStream data, long size)
      throws IOException {
    if (size < 0) {
      throw new IllegalArgumentException("Chunk size must not be negative");
    }
    String key = chunkKeys.chunkKey(sessionId, partNumber);

    try (InputStream in = data) {
      objectStoreClient.putObject(bucket, key, in, size, CHUNK_CONTENT_TYPE);
    }

    structuredLogger.logChunkReceived(sessionId, partNumber, size);
    return new ChunkReceipt(partNumber, size);
  }
}
