package com.scholary.audio.upload.streaming;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MediaTypesTest {

  @Test
  void forKey_shouldMapAudioExtensions() {
    assertThat(MediaTypes.forKey("audio/l/0_1.mp3")).isEqualTo("audio/mpeg");
    assertThat(MediaTypes.forKey("audio/l/0_1.M4A")).isEqualTo("audio/mp4");
    assertThat(MediaTypes.forKey("audio/l/0_1.opus")).isEqualTo("audio/ogg");
    assertThat(MediaTypes.forKey("covers/l/cover.webp")).isEqualTo("image/webp");
  }

  @Test
  void forKey_shouldFallBackToOctetStream() {
    assertThat(MediaTypes.forKey("audio/l/0_1.xyz")).isEqualTo(MediaTypes.DEFAULT);
    assertThat(MediaTypes.forKey("audio/v1.2/noext")).isEqualTo(MediaTypes.DEFAULT);
  }
}
