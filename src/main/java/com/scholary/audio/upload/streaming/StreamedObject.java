package com.scholary.audio.upload.streaming;

import java.io.InputStream;
import java.util.Map;

/**
 * An object being relayed to a client.
 *
 * @param status HTTP status to answer with (200, 206 or 416)
 * @param headers response headers to set
 * @param body upstream body; the caller must close it
 */
public record StreamedObject(int status, Map<String, String> headers, InputStream body) {}
