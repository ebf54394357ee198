package com.scholary.audio.upload.assembly;

import com.scholary.audio.upload.objectstore.InMemoryObjectStoreClient;
import com.scholary.audio.upload.session.ChunkKeys;
import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Builders for chunked test content. */
final class ChunkFixtures {

  static final String BUCKET = "test-bucket";
  static final ChunkKeys CHUNK_KEYS = new ChunkKeys("_chunks");
  static final int MB = 1024 * 1024;

  private ChunkFixtures() {}

  /** Chunk {@code index} filled with a pattern that differs per chunk and per position. */
  static byte[] chunk(int index, int size) {
    byte[] data = new byte[size];
    for (int i = 0; i < size; i++) {
      data[i] = (byte) (index * 31 + i);
    }
    return data;
  }

  /** Store {@code count} chunks of {@code size} bytes and return their keys in part order. */
  static List<String> storeChunks(
      InMemoryObjectStoreClient store, String sessionId, int count, int size) {
    List<String> keys = new ArrayList<>();
    for (int part = 1; part <= count; part++) {
      String key = CHUNK_KEYS.chunkKey(sessionId, part);
      store.putObject(BUCKET, key, chunk(part, size), "application/octet-stream");
      keys.add(key);
    }
    return keys;
  }

  static byte[] expectedConcatenation(int count, int size) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(count * size);
    for (int part = 1; part <= count; part++) {
      out.writeBytes(chunk(part, size));
    }
    return out.toByteArray();
  }

  static ReconstructionContext context(
      String sessionId, String targetKey, List<String> chunkKeys, MutableClock clock) {
    return new ReconstructionContext(
        sessionId,
        BUCKET,
        targetKey,
        "audio/mpeg",
        chunkKeys,
        Deadline.after(sessionId, Duration.ofMinutes(5), clock));
  }

  static MutableClock clock() {
    return new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
  }
}
