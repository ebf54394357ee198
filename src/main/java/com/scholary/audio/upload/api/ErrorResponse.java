package com.scholary.audio.upload.api;

/**
 * Error body returned by every endpoint.
 *
 * @param error stable error code, e.g. {@code PartCountMismatch}
 * @param message human-readable detail
 * @param retryable whether repeating the same call can succeed
 */
public record ErrorResponse(String error, String message, boolean retryable) {}
