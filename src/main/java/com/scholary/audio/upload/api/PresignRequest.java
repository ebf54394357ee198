package com.scholary.audio.upload.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/** Request for a presigned direct-upload URL. */
public record PresignRequest(
    @NotBlank @Pattern(regexp = "[^/]+") String ownerId,
    @NotBlank String fileName,
    String contentType,
    @Min(0) int sortOrder) {}
