package com.scholary.audio.upload.assembly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.scholary.audio.upload.catalog.AssetRecorder;
import com.scholary.audio.upload.catalog.CatalogException;
import org.junit.jupiter.api.Test;

class AssetCatalogerTest {

  private static final AssembledObject OBJECT =
      new AssembledObject("audio/lesson-1/1_0.flac", 42, "audio/flac", AudioCodec.FLAC);

  private final AssetRecorder recorder = mock(AssetRecorder.class);
  private final AssetCataloger cataloger =
      new AssetCataloger(recorder, new FinalKeys("audio", ChunkFixtures.clock()));

  @Test
  void record_shouldNotTouchParentWhenAssetRecordSucceeds() {
    boolean recorded = cataloger.record("lesson-1", "talk.flac", 1, OBJECT, "/u");

    assertThat(recorded).isTrue();
    verify(recorder, never()).updateParentRecord(any());
  }

  @Test
  void record_shouldReportDegradedOutcomeEvenWhenFallbackFails() {
    doThrow(new CatalogException("down")).when(recorder).recordAsset(any());
    doThrow(new CatalogException("still down")).when(recorder).updateParentRecord(any());

    assertThat(cataloger.record("lesson-1", "talk.flac", 1, OBJECT, "/u")).isFalse();
  }

  @Test
  void originalKey_shouldUseSortOrderPrefixedName() {
    assertThat(cataloger.originalKey("lesson-1", "talk.flac", 1))
        .isEqualTo("originals/lesson-1/original.flac");
  }
}
