package com.scholary.audio.upload.objectstore;

import java.io.InputStream;
import java.net.URI;
import java.net.URL;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListPartsRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.NoSuchUploadException;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.Part;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

/**
 * S3-compatible implementation of ObjectStoreClient.
 *
 * <p>Uses AWS SDK v2, which works with real S3 as well as R2 and MinIO. The differences between
 * backends are the endpoint and path-style access configuration.
 *
 * <p>Retry logic: the SDK retries transient failures (network issues, 500s, throttling) with
 * backoff. Each API call is bounded by {@code objectstore.apiCallTimeout} so a stuck call cannot
 * hold an assembly past its deadline. Non-retryable errors (404, 403) fail fast.
 */
public class S3ObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  // DeleteObjects accepts at most 1000 keys per request
  private static final int DELETE_BATCH_SIZE = 1000;

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());
    StaticCredentialsProvider credentialsProvider = StaticCredentialsProvider.create(credentials);

    // R2 accepts any region name; "auto" is its convention, us-east-1 works everywhere
    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    this.s3Client =
        S3Client.builder()
            .region(region)
            .credentialsProvider(credentialsProvider)
            .endpointOverride(URI.create(properties.endpoint()))
            .forcePathStyle(properties.pathStyleAccess())
            .overrideConfiguration(
                ClientOverrideConfiguration.builder()
                    .apiCallTimeout(properties.apiCallTimeout())
                    .build())
            .build();

    this.s3Presigner =
        S3Presigner.builder()
            .region(region)
            .credentialsProvider(credentialsProvider)
            .endpointOverride(URI.create(properties.endpoint()))
            .serviceConfiguration(
                S3Configuration.builder()
                    .pathStyleAccessEnabled(properties.pathStyleAccess())
                    .build())
            .build();

    LOGGER.info("S3 client initialized successfully");
  }

  S3ObjectStoreClient(S3Client s3Client, S3Presigner s3Presigner) {
    this.s3Client = s3Client;
    this.s3Presigner = s3Presigner;
  }

  @Override
  public byte[] getObjectBytes(String bucket, String key) {
    LOGGER.debug("Downloading object: bucket={}, key={}", bucket, key);

    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
      byte[] bytes = s3Client.getObjectAsBytes(request).asByteArray();

      LOGGER.debug("Downloaded object: bucket={}, key={}, size={}", bucket, key, bytes.length);
      return bytes;

    } catch (NoSuchKeyException e) {
      throw notFound(bucket, key, e);
    } catch (Exception e) {
      throw failure("download object", bucket, key, e);
    }
  }

  @Override
  public void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
        bucket,
        key,
        contentLength,
        contentType);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength(contentLength)
              .build();

      s3Client.putObject(request, RequestBody.fromInputStream(data, contentLength));

      LOGGER.info("Successfully uploaded object: bucket={}, key={}", bucket, key);

    } catch (Exception e) {
      throw failure("upload object", bucket, key, e);
    }
  }

  @Override
  public void putObject(String bucket, String key, byte[] data, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
        bucket,
        key,
        data.length,
        contentType);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength((long) data.length)
              .build();

      s3Client.putObject(request, RequestBody.fromBytes(data));

      LOGGER.debug("Uploaded object: bucket={}, key={}, size={}", bucket, key, data.length);

    } catch (Exception e) {
      throw failure("upload object", bucket, key, e);
    }
  }

  @Override
  public List<String> listKeys(String bucket, String prefix) {
    LOGGER.debug("Listing objects: bucket={}, prefix={}", bucket, prefix);

    try {
      ListObjectsV2Request request =
          ListObjectsV2Request.builder().bucket(bucket).prefix(prefix).build();

      // The paginator follows continuation tokens past the 1000-key page limit
      List<String> keys = new ArrayList<>();
      for (S3Object object : s3Client.listObjectsV2Paginator(request).contents()) {
        keys.add(object.key());
      }
      keys.sort(null);

      LOGGER.debug("Listed {} objects: bucket={}, prefix={}", keys.size(), bucket, prefix);
      return keys;

    } catch (Exception e) {
      throw failure("list objects", bucket, prefix, e);
    }
  }

  @Override
  public void deleteObject(String bucket, String key) {
    LOGGER.debug("Deleting object: bucket={}, key={}", bucket, key);

    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
    } catch (Exception e) {
      throw failure("delete object", bucket, key, e);
    }
  }

  @Override
  public int deletePrefix(String bucket, String prefix) {
    List<String> keys = listKeys(bucket, prefix);
    if (keys.isEmpty()) {
      return 0;
    }

    try {
      for (int from = 0; from < keys.size(); from += DELETE_BATCH_SIZE) {
        List<ObjectIdentifier> batch =
            keys.subList(from, Math.min(from + DELETE_BATCH_SIZE, keys.size())).stream()
                .map(key -> ObjectIdentifier.builder().key(key).build())
                .toList();

        DeleteObjectsResponse response =
            s3Client.deleteObjects(
                DeleteObjectsRequest.builder()
                    .bucket(bucket)
                    .delete(Delete.builder().objects(batch).quiet(true).build())
                    .build());

        if (response.hasErrors() && !response.errors().isEmpty()) {
          throw new ObjectStoreException(
              String.format(
                  "Failed to delete %d objects: bucket=%s, prefix=%s, firstError=%s",
                  response.errors().size(), bucket, prefix, response.errors().get(0).message()));
        }
      }

      LOGGER.info("Deleted {} objects: bucket={}, prefix={}", keys.size(), bucket, prefix);
      return keys.size();

    } catch (ObjectStoreException e) {
      throw e;
    } catch (Exception e) {
      throw failure("delete prefix", bucket, prefix, e);
    }
  }

  @Override
  public boolean exists(String bucket, String key) {
    try {
      s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        return false;
      }
      throw failure("check object", bucket, key, e);
    } catch (Exception e) {
      throw failure("check object", bucket, key, e);
    }
  }

  @Override
  public URL presignGet(String bucket, String key, Duration ttl) {
    LOGGER.debug("Generating presigned GET URL: bucket={}, key={}, ttl={}", bucket, key, ttl);

    try {
      GetObjectRequest getObjectRequest =
          GetObjectRequest.builder().bucket(bucket).key(key).build();

      GetObjectPresignRequest presignRequest =
          GetObjectPresignRequest.builder()
              .signatureDuration(ttl)
              .getObjectRequest(getObjectRequest)
              .build();

      return s3Presigner.presignGetObject(presignRequest).url();

    } catch (Exception e) {
      throw failure("generate presigned GET URL", bucket, key, e);
    }
  }

  @Override
  public URL presignPut(String bucket, String key, String contentType, Duration ttl) {
    LOGGER.debug("Generating presigned PUT URL: bucket={}, key={}, ttl={}", bucket, key, ttl);

    try {
      PutObjectRequest putObjectRequest =
          PutObjectRequest.builder().bucket(bucket).key(key).contentType(contentType).build();

      PutObjectPresignRequest presignRequest =
          PutObjectPresignRequest.builder()
              .signatureDuration(ttl)
              .putObjectRequest(putObjectRequest)
              .build();

      return s3Presigner.presignPutObject(presignRequest).url();

    } catch (Exception e) {
      throw failure("generate presigned PUT URL", bucket, key, e);
    }
  }

  @Override
  public String createMultipartUpload(String bucket, String key, String contentType) {
    try {
      String uploadId =
          s3Client
              .createMultipartUpload(
                  CreateMultipartUploadRequest.builder()
                      .bucket(bucket)
                      .key(key)
                      .contentType(contentType)
                      .build())
              .uploadId();

      LOGGER.info("Created multipart upload: bucket={}, key={}, uploadId={}", bucket, key, uploadId);
      return uploadId;

    } catch (Exception e) {
      throw failure("create multipart upload", bucket, key, e);
    }
  }

  @Override
  public CompletedPart uploadPart(
      String bucket, String key, String uploadId, int partNumber, byte[] data) {
    try {
      UploadPartRequest request =
          UploadPartRequest.builder()
              .bucket(bucket)
              .key(key)
              .uploadId(uploadId)
              .partNumber(partNumber)
              .contentLength((long) data.length)
              .build();

      String eTag = s3Client.uploadPart(request, RequestBody.fromBytes(data)).eTag();

      LOGGER.debug(
          "Uploaded part: key={}, uploadId={}, partNumber={}, size={}",
          key,
          uploadId,
          partNumber,
          data.length);
      return new CompletedPart(partNumber, eTag, data.length);

    } catch (Exception e) {
      throw failure("upload part " + partNumber, bucket, key, e);
    }
  }

  @Override
  public void completeMultipartUpload(
      String bucket, String key, String uploadId, List<CompletedPart> parts) {
    try {
      List<software.amazon.awssdk.services.s3.model.CompletedPart> completedParts =
          parts.stream()
              .map(
                  part ->
                      software.amazon.awssdk.services.s3.model.CompletedPart.builder()
                          .partNumber(part.partNumber())
                          .eTag(part.eTag())
                          .build())
              .toList();

      s3Client.completeMultipartUpload(
          CompleteMultipartUploadRequest.builder()
              .bucket(bucket)
              .key(key)
              .uploadId(uploadId)
              .multipartUpload(CompletedMultipartUpload.builder().parts(completedParts).build())
              .build());

      LOGGER.info(
          "Completed multipart upload: bucket={}, key={}, uploadId={}, parts={}",
          bucket,
          key,
          uploadId,
          parts.size());

    } catch (Exception e) {
      throw failure("complete multipart upload", bucket, key, e);
    }
  }

  @Override
  public void abortMultipartUpload(String bucket, String key, String uploadId) {
    try {
      s3Client.abortMultipartUpload(
          AbortMultipartUploadRequest.builder().bucket(bucket).key(key).uploadId(uploadId).build());

      LOGGER.info("Aborted multipart upload: bucket={}, key={}, uploadId={}", bucket, key, uploadId);

    } catch (NoSuchUploadException e) {
      LOGGER.debug("Multipart upload already gone: key={}, uploadId={}", key, uploadId);
    } catch (Exception e) {
      throw failure("abort multipart upload", bucket, key, e);
    }
  }

  @Override
  public List<CompletedPart> listParts(String bucket, String key, String uploadId) {
    try {
      List<CompletedPart> parts = new ArrayList<>();
      ListPartsRequest request =
          ListPartsRequest.builder().bucket(bucket).key(key).uploadId(uploadId).build();
      for (Part part : s3Client.listPartsPaginator(request).parts()) {
        parts.add(new CompletedPart(part.partNumber(), part.eTag(), part.size()));
      }
      return parts;

    } catch (NoSuchUploadException e) {
      return List.of();
    } catch (Exception e) {
      throw failure("list parts", bucket, key, e);
    }
  }

  /**
   * Clean up resources when the client is no longer needed.
   *
   * <p>Registered as the bean's destroy method so connections are released on shutdown.
   */
  public void close() {
    LOGGER.info("Closing S3 client and presigner");
    s3Client.close();
    s3Presigner.close();
  }

  private static ObjectStoreException notFound(String bucket, String key, Exception cause) {
    String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
    LOGGER.warn(message);
    return ObjectStoreException.notFound(message, cause);
  }

  private static ObjectStoreException failure(
      String action, String bucket, String key, Exception cause) {
    String message =
        cause instanceof S3Exception s3Exception
            ? String.format(
                "Failed to %s: bucket=%s, key=%s, statusCode=%s",
                action, bucket, key, s3Exception.statusCode())
            : String.format("Unexpected error trying to %s: bucket=%s, key=%s", action, bucket, key);
    LOGGER.error(message, cause);
    return new ObjectStoreException(message, cause);
  }
}
