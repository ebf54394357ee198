package com.scholary.audio.upload.api;

import com.scholary.audio.upload.assembly.AssembledObject;
import com.scholary.audio.upload.assembly.AssemblyRequest;
import com.scholary.audio.upload.assembly.AssemblyResult;
import com.scholary.audio.upload.assembly.FinalKeys;
import com.scholary.audio.upload.assembly.UploadAssembler;
import com.scholary.audio.upload.config.UploadProperties;
import com.scholary.audio.upload.logging.StructuredLogger;
import com.scholary.audio.upload.objectstore.ObjectStoreClient;
import com.scholary.audio.upload.objectstore.ObjectStoreProperties;
import com.scholary.audio.upload.receiver.ChunkReceipt;
import com.scholary.audio.upload.receiver.ChunkReceiver;
import com.scholary.audio.upload.receiver.DirectUploadRequest;
import com.scholary.audio.upload.receiver.DirectUploadResult;
import com.scholary.audio.upload.receiver.DirectUploader;
import com.scholary.audio.upload.session.UploadSession;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.net.URL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for chunked audio uploads.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Storing a whole file in one request
 *   <li>Storing one chunk of an upload session
 *   <li>Assembling a session into its final object
 *   <li>Presigning a direct upload for files small enough to skip chunking
 * </ul>
 */
@RestController
@RequestMapping("/api/upload")
@Tag(name = "Upload", description = "Chunked audio upload and assembly API")
public class UploadController {

  private static final Logger LOGGER = LoggerFactory.getLogger(UploadController.class);
  private static final String DEFAULT_CONTENT_TYPE = "audio/mpeg";

  private final ChunkReceiver chunkReceiver;
  private final UploadAssembler uploadAssembler;
  private final DirectUploader directUploader;
  private final FinalKeys finalKeys;
  private final ObjectStoreClient objectStoreClient;
  private final String bucket;
  private final UploadProperties uploadProperties;

  public UploadController(
      ChunkReceiver chunkReceiver,
      UploadAssembler uploadAssembler,
      DirectUploader directUploader,
      FinalKeys finalKeys,
      ObjectStoreClient objectStoreClient,
      ObjectStoreProperties objectStoreProperties,
      UploadProperties uploadProperties) {
    this.chunkReceiver = chunkReceiver;
    this.uploadAssembler = uploadAssembler;
    this.directUploader = directUploader;
    this.finalKeys = finalKeys;
    this.objectStoreClient = objectStoreClient;
    this.bucket = objectStoreProperties.bucket();
    this.uploadProperties = uploadProperties;
  }

  /** Store a whole file at its final key and record it. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Upload a whole file",
      description =
          "Store a file small enough to send in one request and record the asset, without "
              + "chunking or a presigned URL")
  public ResponseEntity<DirectUploadResponse> upload(
      @RequestPart("file") MultipartFile file,
      @RequestParam("ownerId") String ownerId,
      @RequestParam("fileName") String fileName,
      @RequestParam(value = "contentType", required = false) String contentType,
      @RequestParam(value = "sortOrder", defaultValue = "0") int sortOrder)
      throws IOException {
    if (fileName.isBlank()) {
      throw new IllegalArgumentException("fileName must not be blank");
    }
    String resolvedType =
        contentTypeOrDefault(
            contentType == null || contentType.isBlank() ? file.getContentType() : contentType);

    DirectUploadResult result =
        directUploader.upload(
            new DirectUploadRequest(ownerId, fileName, sortOrder, resolvedType),
            file.getInputStream(),
            file.getSize());

    AssembledObject object = result.object();
    return ResponseEntity.ok(
        new DirectUploadResponse(
            true,
            object.finalKey(),
            result.originalKey(),
            result.publicUrl(),
            object.byteSize(),
            object.contentType(),
            object.codec().label(),
            result.catalogRecorded()));
  }

  /** Store one chunk as a temporary object. Re-sending a part overwrites it. */
  @PostMapping(value = "/chunk", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Upload one chunk",
      description =
          "Store one part of an upload session. Parts are 1-based; ordering and completeness "
              + "are only checked at assembly time.")
  public ResponseEntity<ChunkUploadResponse> uploadChunk(
      @RequestParam("sessionId") String sessionId,
      @RequestParam("partNumber") int partNumber,
      @RequestPart("chunk") MultipartFile chunk)
      throws IOException {
    try {
      StructuredLogger.setSessionContext(sessionId, bucket);

      ChunkReceipt receipt =
          chunkReceiver.receive(sessionId, partNumber, chunk.getInputStream(), chunk.getSize());
      return ResponseEntity.ok(
          new ChunkUploadResponse(true, receipt.partNumber(), receipt.storedSize()));

    } finally {
      StructuredLogger.clearSessionContext();
    }
  }

  /** Assemble all chunks of a session into the final audio object. */
  @PostMapping("/complete")
  @Operation(
      summary = "Complete an upload",
      description =
          "Assemble the chunks of a session into one object, delete the chunks and record the "
              + "asset. Fails with NoChunksFound or PartCountMismatch when the upload must be "
              + "restarted, or StorageFailure when the call may be retried.")
  public ResponseEntity<CompleteUploadResponse> complete(
      @Valid @RequestBody CompleteUploadRequest request) {
    try {
      StructuredLogger.setSessionContext(request.sessionId(), bucket);
      LOGGER.info(
          "Complete request: sessionId={}, owner={}, file={}, totalParts={}",
          request.sessionId(),
          request.ownerId(),
          request.fileName(),
          request.totalParts());

      String contentType = contentTypeOrDefault(request.contentType());
      String finalKey =
          finalKeys.finalKey(request.ownerId(), request.sortOrder(), request.fileName());

      UploadSession session =
          new UploadSession(
              request.sessionId(),
              request.totalParts(),
              finalKey,
              contentType,
              request.fileSize());

      AssemblyResult result =
          uploadAssembler.assemble(
              new AssemblyRequest(
                  session, request.ownerId(), request.fileName(), request.sortOrder()));

      AssembledObject object = result.object();
      return ResponseEntity.ok(
          new CompleteUploadResponse(
              true,
              object.finalKey(),
              result.publicUrl(),
              object.byteSize(),
              object.contentType(),
              object.codec().label(),
              result.catalogRecorded(),
              result.cleanupComplete()));

    } finally {
      StructuredLogger.clearSessionContext();
    }
  }

  /** Presign a direct PUT to the final key. */
  @PostMapping("/presign")
  @Operation(
      summary = "Presign a direct upload",
      description = "Return a presigned PUT URL so small files can be uploaded without chunking")
  public ResponseEntity<PresignResponse> presign(@Valid @RequestBody PresignRequest request) {
    String contentType = contentTypeOrDefault(request.contentType());
    String finalKey =
        finalKeys.finalKey(request.ownerId(), request.sortOrder(), request.fileName());

    URL url =
        objectStoreClient.presignPut(
            bucket, finalKey, contentType, uploadProperties.presignTtl());

    LOGGER.info("Presigned direct upload: owner={}, key={}", request.ownerId(), finalKey);
    return ResponseEntity.ok(
        new PresignResponse(
            url.toString(), finalKey, FinalKeys.publicUrl(finalKey), contentType));
  }

  private static String contentTypeOrDefault(String contentType) {
    return contentType == null || contentType.isBlank() ? DEFAULT_CONTENT_TYPE : contentType;
  }
}
