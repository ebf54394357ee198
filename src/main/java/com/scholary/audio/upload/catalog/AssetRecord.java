package com.scholary.audio.upload.catalog;

/**
 * Catalog entry pointing at an assembled audio object.
 *
 * @param ownerId id of the owning catalog entry
 * @param finalKey key of the assembled object
 * @param publicUrl playback URL
 * @param originalName file name as uploaded
 * @param byteSize object size
 * @param codec codec label, e.g. {@code mp3}
 * @param sortOrder position among the owner's audio files
 */
public record AssetRecord(
    String ownerId,
    String finalKey,
    String publicUrl,
    String originalName,
    long byteSize,
    String codec,
    int sortOrder) {}
