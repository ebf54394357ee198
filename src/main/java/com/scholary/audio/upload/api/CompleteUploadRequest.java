package com.scholary.audio.upload.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request to assemble the chunks of an upload session.
 *
 * <p>{@code totalParts} and {@code fileSize} are optional. Without {@code totalParts} every listed
 * chunk is used; without {@code fileSize} the size is estimated from the chunk count.
 */
public record CompleteUploadRequest(
    @NotBlank @Pattern(regexp = "[A-Za-z0-9_-]{1,128}") String sessionId,
    @Positive Integer totalParts,
    @NotBlank @Pattern(regexp = "[^/]+") String ownerId,
    @NotBlank String fileName,
    String contentType,
    @PositiveOrZero Long fileSize,
    @Min(0) int sortOrder) {}
