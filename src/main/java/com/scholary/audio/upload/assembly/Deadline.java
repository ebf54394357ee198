package com.scholary.audio.upload.assembly;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deadline of one assembly call.
 *
 * <p>Strategies check it between store calls; expiry is raised as an
 * {@link AssemblyTimeoutException} and goes through the same rollback as any other failure.
 */
public final class Deadline {

  private final String sessionId;
  private final Duration timeout;
  private final Instant expiresAt;
  private final Clock clock;

  private Deadline(String sessionId, Duration timeout, Clock clock) {
    this.sessionId = sessionId;
    this.timeout = timeout;
    this.clock = clock;
    this.expiresAt = clock.instant().plus(timeout);
  }

  public static Deadline after(String sessionId, Duration timeout, Clock clock) {
    return new Deadline(sessionId, timeout, clock);
  }

  public boolean isExpired() {
    return !clock.instant().isBefore(expiresAt);
  }

  /**
   * @param stage what the assembly is about to do, for the error message
   * @throws AssemblyTimeoutException if the deadline has passed
   */
  public void checkNotExpired(String stage) {
    if (isExpired()) {
      throw new AssemblyTimeoutException(sessionId, timeout, stage);
    }
  }
}
