package com.scholary.audio.upload.receiver;

/**
 * A whole audio file uploaded in one request.
 *
 * @param ownerId id of the catalog entry owning the audio
 * @param fileName file name as chosen by the user
 * @param sortOrder position of the audio among its owner's files
 * @param contentType MIME type to store the object with
 */
public record DirectUploadRequest(
    String ownerId, String fileName, int sortOrder, String contentType) {}
