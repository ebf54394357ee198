package com.scholary.audio.upload.catalog;

/**
 * Degraded catalog write: points the owning record itself at the audio when the asset record
 * cannot be created.
 */
public record ParentRecordUpdate(
    String ownerId, String publicUrl, String originalKey, long byteSize, String codec) {}
