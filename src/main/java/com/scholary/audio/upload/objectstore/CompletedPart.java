package com.scholary.audio.upload.objectstore;

/**
 * One uploaded part of a multipart upload.
 *
 * @param partNumber 1-based part number, ascending in upload order
 * @param eTag the opaque identifier returned by the backend for this part
 * @param size number of bytes in the part
 */
public record CompletedPart(int partNumber, String eTag, long size) {

  public CompletedPart {
    if (partNumber < 1) {
      throw new IllegalArgumentException("Part number must be >= 1");
    }
    if (eTag == null || eTag.isBlank()) {
      throw new IllegalArgumentException("ETag must not be blank");
    }
  }
}
