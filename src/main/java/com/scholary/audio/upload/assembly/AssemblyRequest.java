package com.scholary.audio.upload.assembly;

import com.scholary.audio.upload.session.UploadSession;

/**
 * Everything an assembly call needs: the session to reconstruct and the catalog details of the
 * asset it becomes.
 *
 * @param session the upload session
 * @param ownerId id of the catalog entry owning the audio (a lesson)
 * @param originalName file name as chosen by the user
 * @param sortOrder position of the audio among its owner's files
 */
public record AssemblyRequest(
    UploadSession session, String ownerId, String originalName, int sortOrder) {}
