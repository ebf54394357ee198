package com.scholary.audio.upload.assembly;

/**
 * The durable result of an assembly. Its shape does not depend on the strategy that produced it.
 *
 * @param finalKey key of the assembled object
 * @param byteSize exact number of bytes written
 * @param contentType MIME type the object was stored with
 * @param codec codec family derived from content type and extension
 */
public record AssembledObject(
    String finalKey, long byteSize, String contentType, AudioCodec codec) {}
