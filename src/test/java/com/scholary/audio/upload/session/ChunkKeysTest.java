package com.scholary.audio.upload.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChunkKeysTest {

  private final ChunkKeys chunkKeys = new ChunkKeys("_chunks");

  @Test
  void chunkKey_shouldZeroPadPartNumber() {
    assertThat(chunkKeys.chunkKey("abc", 1)).isEqualTo("_chunks/abc/part_0001");
    assertThat(chunkKeys.chunkKey("abc", 42)).isEqualTo("_chunks/abc/part_0042");
    assertThat(chunkKeys.chunkKey("abc", 9999)).isEqualTo("_chunks/abc/part_9999");
  }

  @Test
  void sessionPrefix_shouldEndWithSlash() {
    assertThat(chunkKeys.sessionPrefix("abc")).isEqualTo("_chunks/abc/");
  }

  @Test
  void constructor_shouldStripSurroundingSlashes() {
    assertThat(new ChunkKeys("/tmp/chunks/").sessionPrefix("s1")).isEqualTo("tmp/chunks/s1/");
  }

  @Test
  void constructor_shouldRejectEmptyPrefix() {
    assertThatThrownBy(() -> new ChunkKeys("/"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void lexicographicOrder_shouldMatchNumericOrder() {
    List<String> keys = new ArrayList<>();
    for (int part : new int[] {10, 2, 100, 1, 9}) {
      keys.add(chunkKeys.chunkKey("s", part));
    }
    Collections.sort(keys);

    assertThat(keys).extracting(ChunkKeys::partNumberOf).containsExactly(1, 2, 9, 10, 100);
  }

  @Test
  void partNumberOf_shouldRejectForeignKeys() {
    assertThatThrownBy(() -> ChunkKeys.partNumberOf("_chunks/s/readme.txt"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Not a chunk key");
  }

  @Test
  void chunkKey_shouldRejectPartNumbersOutOfRange() {
    assertThatThrownBy(() -> chunkKeys.chunkKey("s", 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> chunkKeys.chunkKey("s", 10000))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void sessionIds_shouldNotEscapeTheirPrefix() {
    assertThat(ChunkKeys.isValidSessionId("upload_123-abc")).isTrue();
    assertThat(ChunkKeys.isValidSessionId("../other")).isFalse();
    assertThat(ChunkKeys.isValidSessionId("a/b")).isFalse();
    assertThat(ChunkKeys.isValidSessionId("")).isFalse();
    assertThat(ChunkKeys.isValidSessionId(null)).isFalse();
    assertThat(ChunkKeys.isValidSessionId("x".repeat(129))).isFalse();
  }
}
