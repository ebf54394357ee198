package com.scholary.audio.upload.assembly;

/**
 * What a strategy did.
 *
 * @param byteSize bytes written to the target
 * @param storagePuts number of write calls against the target (one put, or one per part)
 * @param peakBufferedBytes largest amount of chunk data buffered at once, not counting the part
 *     array briefly built from the buffer before each upload
 */
public record ReconstructionOutcome(long byteSize, int storagePuts, long peakBufferedBytes) {}
