package com.scholary.audio.upload.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class UploadSessionTest {

  @Test
  void constructor_shouldAcceptOptionalCountAndSize() {
    UploadSession session = new UploadSession("s1", null, "audio/o/1_2.mp3", "audio/mpeg", null);

    assertThat(session.expectedParts()).isNull();
    assertThat(session.declaredSize()).isNull();
  }

  @Test
  void constructor_shouldRejectNonPositiveExpectedParts() {
    assertThatThrownBy(() -> new UploadSession("s1", 0, "k.mp3", "audio/mpeg", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Expected parts");
  }

  @Test
  void constructor_shouldRejectInvalidSessionId() {
    assertThatThrownBy(() -> new UploadSession("a/b", 1, "k.mp3", "audio/mpeg", null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_shouldRejectBlankTargetKey() {
    assertThatThrownBy(() -> new UploadSession("s1", 1, " ", "audio/mpeg", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Target key");
  }
}
