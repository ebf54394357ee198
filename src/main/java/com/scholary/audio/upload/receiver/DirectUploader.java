package com.scholary.audio.upload.receiver;

import com.scholary.audio.upload.assembly.AssembledObject;
import com.scholary.audio.upload.assembly.AssetCataloger;
import com.scholary.audio.upload.assembly.AudioCodec;
import com.scholary.audio.upload.assembly.FinalKeys;
import com.scholary.audio.upload.objectstore.ObjectStoreClient;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Stores a whole file in one put and records it, for uploads small enough to skip chunking.
 *
 * <p>The object lands at the same final key scheme as an assembled upload and is catalogued the
 * same way, including the parent-record fallback.
 */
@Service
public class DirectUploader {

  private static final Logger LOGGER = LoggerFactory.getLogger(DirectUploader.class);

  private final ObjectStoreClient objectStoreClient;
  private final FinalKeys finalKeys;
  private final AssetCataloger assetCataloger;
  private final String bucket;

  public DirectUploader(
      ObjectStoreClient objectStoreClient,
      FinalKeys finalKeys,
      AssetCataloger assetCataloger,
      @Value("${objectstore.bucket}") String bucket) {
    this.objectStoreClient = objectStoreClient;
    this.finalKeys = finalKeys;
    this.assetCataloger = assetCataloger;
    this.bucket = bucket;
  }

  /**
   * Store and record one file.
   *
   * @param request owner and naming details
   * @param data the file content; closed when done
   * @param size exact content length
   * @throws IOException if reading the content fails
   * @throws IllegalArgumentException if the owner id is invalid or the size is negative
   * @throws com.scholary.audio.upload.objectstore.ObjectStoreException if the write fails
   */
  public DirectUploadResult upload(DirectUploadRequest request, InputStream data, long size)
      throws IOException {
    if (size < 0) {
      throw new IllegalArgumentException("File size must not be negative");
    }
    String finalKey =
        finalKeys.finalKey(request.ownerId(), request.sortOrder(), request.fileName());

    try (InputStream in = data) {
      objectStoreClient.putObject(bucket, finalKey, in, size, request.contentType());
    }

    AssembledObject object =
        new AssembledObject(
            finalKey,
            size,
            request.contentType(),
            AudioCodec.detect(request.contentType(), AudioCodec.extensionOf(finalKey)));
    String publicUrl = FinalKeys.publicUrl(finalKey);
    LOGGER.info(
        "Stored direct upload: owner={}, key={}, size={}", request.ownerId(), finalKey, size);

    boolean recorded =
        assetCataloger.record(
            request.ownerId(), request.fileName(), request.sortOrder(), object, publicUrl);
    return new DirectUploadResult(
        object,
        publicUrl,
        assetCataloger.originalKey(request.ownerId(), request.fileName(), request.sortOrder()),
        recorded);
  }
}
