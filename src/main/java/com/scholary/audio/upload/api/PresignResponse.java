package com.scholary.audio.upload.api;

/** Presigned PUT URL plus the key and playback URL the object will have. */
public record PresignResponse(
    String presignedUrl, String fileKey, String publicUrl, String contentType) {}
