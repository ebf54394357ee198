package com.scholary.audio.upload.assembly;

import com.scholary.audio.upload.logging.StructuredLogger;
import com.scholary.audio.upload.objectstore.CompletedPart;
import com.scholary.audio.upload.objectstore.ObjectStoreClient;
import com.scholary.audio.upload.objectstore.ObjectStoreException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

/**
 * Large-file path: stream chunks into a backend multipart upload.
 *
 * <p>Chunks are processed strictly in part order. Each one is downloaded, appended to a
 * {@link PartAccumulator} and deleted from the store straight away. Whenever the accumulator
 * reaches the minimum part size, or the last chunk has been appended, its content is uploaded as
 * the next part. Memory use is therefore bounded by the minimum part size plus one chunk,
 * whatever the file size.
 *
 * <p>Any failure, including an expired deadline, aborts the multipart upload before the error
 * propagates. An open multipart upload keeps its parts billed until it is aborted, so abort is
 * part of the failure contract.
 */
@Component
public class MultipartStrategy implements ReconstructionStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(MultipartStrategy.class);

  public static final String NAME = "multipart";

  private final ObjectStoreClient objectStoreClient;
  private final ChunkCleaner chunkCleaner;
  private final long minPartSize;
  private final StructuredLogger structuredLogger;

  public MultipartStrategy(
      ObjectStoreClient objectStoreClient,
      ChunkCleaner chunkCleaner,
      @Value("${upload.minPartSize:5MB}") DataSize minPartSize) {
    if (minPartSize.toBytes() < ObjectStoreClient.MIN_MULTIPART_PART_SIZE) {
      throw new IllegalArgumentException(
          "Minimum part size must be at least " + ObjectStoreClient.MIN_MULTIPART_PART_SIZE);
    }
    this.objectStoreClient = objectStoreClient;
    this.chunkCleaner = chunkCleaner;
    this.minPartSize = minPartSize.toBytes();
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  @Override
  public ReconstructionOutcome reconstruct(ReconstructionContext context) {
    String bucket = context.bucket();
    String targetKey = context.targetKey();
    List<String> chunkKeys = context.chunkKeys();

    context.deadline().checkNotExpired("multipart upload creation");
    String uploadId =
        objectStoreClient.createMultipartUpload(bucket, targetKey, context.contentType());

    List<CompletedPart> parts = new ArrayList<>();
    PartAccumulator accumulator = new PartAccumulator();
    long total = 0;
    int undeletedChunks = 0;

    try {
      for (int i = 0; i < chunkKeys.size(); i++) {
        String chunkKey = chunkKeys.get(i);
        context.deadline().checkNotExpired("download of " + chunkKey);

        byte[] chunk = objectStoreClient.getObjectBytes(bucket, chunkKey);
        total += chunk.length;
        accumulator.append(chunk);

        // The bytes are in memory now; free the backend copy right away
        if (!chunkCleaner.deleteChunk(bucket, chunkKey).isSuccess()) {
          undeletedChunks++;
        }

        boolean lastChunk = i == chunkKeys.size() - 1;
        if (accumulator.size() >= minPartSize || lastChunk) {
          int partNumber = parts.size() + 1;
          CompletedPart part =
              objectStoreClient.uploadPart(
                  bucket, targetKey, uploadId, partNumber, accumulator.drain());
          parts.add(part);
          structuredLogger.logPartUploaded(
              uploadId, partNumber, part.size(), accumulator.highWaterMark());
        }
      }

      context.deadline().checkNotExpired("multipart completion");
      objectStoreClient.completeMultipartUpload(bucket, targetKey, uploadId, parts);

    } catch (RuntimeException e) {
      abort(bucket, targetKey, uploadId, e);
      throw e;
    }

    LOGGER.debug(
        "Assembled {} chunks into {} parts: key={}, size={}, peakBuffered={}, leftForSweep={}",
        chunkKeys.size(),
        parts.size(),
        targetKey,
        total,
        accumulator.highWaterMark(),
        undeletedChunks);
    return new ReconstructionOutcome(total, parts.size(), accumulator.highWaterMark());
  }

  @Override
  public String getStrategyName() {
    return NAME;
  }

  @Override
  public boolean consumesChunks() {
    return true;
  }

  private void abort(String bucket, String targetKey, String uploadId, RuntimeException cause) {
    LOGGER.warn(
        "Multipart assembly failed, aborting upload: key={}, uploadId={}, cause={}",
        targetKey,
        uploadId,
        cause.getMessage());
    try {
      objectStoreClient.abortMultipartUpload(bucket, targetKey, uploadId);
    } catch (ObjectStoreException abortFailure) {
      // The upload stays open and billed until a bucket lifecycle rule removes it
      LOGGER.error(
          "Failed to abort multipart upload: key={}, uploadId={}", targetKey, uploadId, abortFailure);
      cause.addSuppressed(abortFailure);
    }
  }
}
