package com.scholary.audio.upload.receiver;

/** Acknowledgement of one stored chunk. */
public record ChunkReceipt(int partNumber, long storedSize) {}
