package com.scholary.audio.upload.receiver;

import com.scholary.audio.upload.assembly.AssembledObject;

/**
 * Outcome of a direct upload.
 *
 * @param object the stored object
 * @param publicUrl playback URL for the object
 * @param originalKey key recorded as the owner's original file
 * @param catalogRecorded false when only the degraded parent-record update ran
 */
public record DirectUploadResult(
    AssembledObject object, String publicUrl, String originalKey, boolean catalogRecorded) {}
