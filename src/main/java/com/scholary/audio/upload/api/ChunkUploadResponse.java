package com.scholary.audio.upload.api;

/** Response for one stored chunk. */
public record ChunkUploadResponse(boolean success, int partNumber, long size) {}
