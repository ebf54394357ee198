package com.scholary.audio.upload.api;

/**
 * Response for a completed assembly.
 *
 * <p>{@code catalogRecorded} is false when the object is stored but the catalog record could only
 * be written in degraded form. {@code cleanupComplete} is false when chunk objects could not all
 * be deleted; they are left to the bucket lifecycle rule.
 */
public record CompleteUploadResponse(
    boolean success,
    String fileKey,
    String publicUrl,
    long byteSize,
    String contentType,
    String codec,
    boolean catalogRecorded,
    boolean cleanupComplete) {}
