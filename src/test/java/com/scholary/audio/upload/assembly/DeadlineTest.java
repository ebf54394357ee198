package com.scholary.audio.upload.assembly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class DeadlineTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

  @Test
  void checkNotExpired_shouldPassBeforeDeadline() {
    Deadline deadline = Deadline.after("s1", Duration.ofSeconds(30), clock);
    clock.advance(Duration.ofSeconds(29));

    assertThat(deadline.isExpired()).isFalse();
    assertThatCode(() -> deadline.checkNotExpired("download")).doesNotThrowAnyException();
  }

  @Test
  void checkNotExpired_shouldThrowRetryableTimeoutOnceExpired() {
    Deadline deadline = Deadline.after("s1", Duration.ofSeconds(30), clock);
    clock.advance(Duration.ofSeconds(30));

    assertThatThrownBy(() -> deadline.checkNotExpired("multipart completion"))
        .isInstanceOf(AssemblyTimeoutException.class)
        .hasMessageContaining("30s")
        .hasMessageContaining("multipart completion")
        .satisfies(e -> assertThat(((AssemblyTimeoutException) e).isRetryable()).isTrue());
  }

  @Test
  void restartRequired_shouldKeepMessageButNotBeRetryable() {
    AssemblyTimeoutException timeout =
        new AssemblyTimeoutException("s1", Duration.ofMinutes(5), "download");

    AssemblyTimeoutException restart = timeout.restartRequired();

    assertThat(restart.isRetryable()).isFalse();
    assertThat(restart.getMessage()).isEqualTo(timeout.getMessage());
    assertThat(restart.getErrorCode()).isEqualTo("AssemblyTimeout");
    assertThat(restart.getSessionId()).isEqualTo("s1");
  }
}
