package com.scholary.audio.upload.api;

/** Response for a file uploaded in a single request. */
public record DirectUploadResponse(
    boolean success,
    String fileKey,
    String originalKey,
    String publicUrl,
    long byteSize,
    String contentType,
    String codec,
    boolean catalogRecorded) {}
