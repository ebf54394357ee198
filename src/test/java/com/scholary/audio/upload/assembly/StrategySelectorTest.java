package com.scholary.audio.upload.assembly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

class StrategySelectorTest {

  private static final long MB = 1024 * 1024;

  private final ConcatStrategy fast = mock(ConcatStrategy.class);
  private final MultipartStrategy large = mock(MultipartStrategy.class);
  private final StrategySelector selector =
      new StrategySelector(fast, large, DataSize.ofMegabytes(10), DataSize.ofKilobytes(3584));

  @Test
  void estimateSize_shouldPreferDeclaredSize() {
    assertThat(selector.estimateSize(42L, 100)).isEqualTo(42L);
  }

  @Test
  void estimateSize_shouldFallBackToNominalChunkSize() {
    assertThat(selector.estimateSize(null, 3)).isEqualTo(3 * 3584 * 1024L);
    assertThat(selector.estimateSize(0L, 2)).isEqualTo(2 * 3584 * 1024L);
  }

  @Test
  void select_shouldUseFastPathBelowThreshold() {
    assertThat(selector.select(10 * MB - 1)).isSameAs(fast);
  }

  @Test
  void select_shouldUseLargeFilePathAtThreshold() {
    assertThat(selector.select(10 * MB)).isSameAs(large);
    assertThat(selector.select(1024 * MB)).isSameAs(large);
  }

  @Test
  void select_shouldSwitchToLargeFilePathAtThreeNominalChunks() {
    // 2 x 3.5 MB = 7 MB, 3 x 3.5 MB = 10.5 MB
    assertThat(selector.select(selector.estimateSize(null, 2))).isSameAs(fast);
    assertThat(selector.select(selector.estimateSize(null, 3))).isSameAs(large);
  }
}
