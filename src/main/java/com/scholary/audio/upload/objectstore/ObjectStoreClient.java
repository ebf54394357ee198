package com.scholary.audio.upload.objectstore;

import java.io.InputStream;
import java.net.URL;
import java.time.Duration;
import java.util.List;

/**
 * Abstraction for object storage operations.
 *
 * <p>The same store holds the temporary chunk objects of an upload session and the final
 * assembled object, so this interface covers plain object CRUD, prefix listing and the native
 * multipart-upload primitives of S3-compatible backends.
 *
 * <p>Every method is a network call. Failures surface as {@link ObjectStoreException}.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve a whole object into memory.
   *
   * <p>Only meant for objects of bounded size, such as a single upload chunk.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return the object content
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  byte[] getObjectBytes(String bucket, String key);

  /**
   * Store an object from a stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the input stream containing object data
   * @param contentLength the size of the object in bytes
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /**
   * Store an object held in memory. Overwrites any existing object at the key.
   *
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(String bucket, String key, byte[] data, String contentType);

  /**
   * List all keys under a prefix, in lexicographic order.
   *
   * @param bucket the bucket name
   * @param prefix the key prefix
   * @return the matching keys, sorted; empty if none
   * @throws ObjectStoreException if listing fails
   */
  List<String> listKeys(String bucket, String prefix);

  /**
   * Delete a single object. Deleting a missing key is a no-op.
   *
   * @throws ObjectStoreException if the delete call fails
   */
  void deleteObject(String bucket, String key);

  /**
   * Delete every object under a prefix.
   *
   * @return the number of keys that were requested for deletion
   * @throws ObjectStoreException if listing or deleting fails
   */
  int deletePrefix(String bucket, String prefix);

  /**
   * Check whether an object exists.
   *
   * @throws ObjectStoreException if the check itself fails
   */
  boolean exists(String bucket, String key);

  /**
   * Generate a presigned URL for temporary read access to an object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param ttl time-to-live for the URL
   * @return a presigned URL
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(String bucket, String key, Duration ttl);

  /**
   * Generate a presigned URL that lets a client PUT an object directly.
   *
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignPut(String bucket, String key, String contentType, Duration ttl);

  /**
   * Open a multipart upload for a key.
   *
   * @return the backend's upload id
   * @throws ObjectStoreException if the upload cannot be created
   */
  String createMultipartUpload(String bucket, String key, String contentType);

  /**
   * Upload one part of a multipart upload.
   *
   * <p>Every part except the last must be at least {@link #MIN_MULTIPART_PART_SIZE} bytes.
   *
   * @return the completed part, carrying the ETag needed to finish the upload
   * @throws ObjectStoreException if the upload fails
   */
  CompletedPart uploadPart(
      String bucket, String key, String uploadId, int partNumber, byte[] data);

  /**
   * Finish a multipart upload. The parts must be in ascending part number order.
   *
   * @throws ObjectStoreException if completion fails
   */
  void completeMultipartUpload(
      String bucket, String key, String uploadId, List<CompletedPart> parts);

  /**
   * Abort a multipart upload and release the storage held by its parts.
   *
   * @throws ObjectStoreException if the abort call fails
   */
  void abortMultipartUpload(String bucket, String key, String uploadId);

  /**
   * List the parts uploaded so far for an open multipart upload.
   *
   * @return the parts; empty if the upload has no parts or no longer exists
   * @throws ObjectStoreException if listing fails for a reason other than a missing upload
   */
  List<CompletedPart> listParts(String bucket, String key, String uploadId);

  /** S3-compatible backends reject non-final parts below this size. */
  long MIN_MULTIPART_PART_SIZE = 5L * 1024 * 1024;
}
