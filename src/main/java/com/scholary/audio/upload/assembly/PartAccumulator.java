package com.scholary.audio.upload.assembly;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Buffer that collects chunk bytes until there is enough for one multipart part.
 *
 * <p>Tracks the largest amount it ever held. The multipart strategy drains it as soon as it
 * reaches the minimum part size, so the high-water mark stays below minimum part size plus one
 * chunk.
 *
 * <p>The high-water mark counts buffered chunk bytes only. While {@link #drain()} runs, the part
 * array and the segments not yet copied into it coexist, so the transient peak approaches twice
 * the buffered size. Each segment is released as soon as it is copied. Not thread-safe.
 */
public class PartAccumulator {

  private final Deque<byte[]> segments = new ArrayDeque<>();
  private long size;
  private long highWaterMark;

  public void append(byte[] data) {
    segments.add(data);
    size += data.length;
    highWaterMark = Math.max(highWaterMark, size);
  }

  public long size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  public long highWaterMark() {
    return highWaterMark;
  }

  /** Return everything buffered as one array and reset to empty. */
  public byte[] drain() {
    byte[] part = new byte[Math.toIntExact(size)];
    int offset = 0;
    byte[] segment;
    while ((segment = segments.pollFirst()) != null) {
      System.arraycopy(segment, 0, part, offset, segment.length);
      offset += segment.length;
    }
    size = 0;
    return part;
  }
}
