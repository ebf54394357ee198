package com.scholary.audio.upload.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Short-lived per-session leases that serialize assembly of one upload session.
 *
 * <p>Two {@code assemble} calls for the same session would otherwise both list the chunks and
 * both write the target. The first caller takes the lease; later callers are refused until it is
 * released or expires. A crashed holder cannot block a session forever, so leases expire.
 *
 * <p>The assembly deadline is only checked between store calls. The call in flight when it passes
 * and the chunk sweep after it may each run for a full store call timeout, so the lease lives for
 * the assembly timeout plus two store call timeouts.
 *
 * <p>Leases are held in a Caffeine cache, so they coordinate callers within one process only.
 */
@Component
public class SessionLeaseRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionLeaseRegistry.class);

  private final Cache<String, String> leases;
  private final Duration leaseTtl;

  public SessionLeaseRegistry(
      @Value("${upload.assemblyTimeout:5m}") Duration assemblyTimeout,
      @Value("${objectstore.apiCallTimeout:60s}") Duration storeCallTimeout) {
    this.leaseTtl = assemblyTimeout.plus(storeCallTimeout.multipliedBy(2));
    this.leases = Caffeine.newBuilder().expireAfterWrite(leaseTtl).build();
  }

  public Duration leaseTtl() {
    return leaseTtl;
  }

  /**
   * Try to take the lease for a session.
   *
   * @return the lease, or empty if another caller holds it
   */
  public Optional<Lease> tryAcquire(String sessionId) {
    String token = UUID.randomUUID().toString();
    String holder = leases.asMap().putIfAbsent(sessionId, token);
    if (holder != null) {
      LOGGER.warn("Session lease already held: sessionId={}", sessionId);
      return Optional.empty();
    }
    LOGGER.debug("Acquired session lease: sessionId={}", sessionId);
    return Optional.of(new Lease(sessionId, token));
  }

  public boolean isHeld(String sessionId) {
    return leases.getIfPresent(sessionId) != null;
  }

  /** A held lease. Closing it releases the session if this lease still owns it. */
  public final class Lease implements AutoCloseable {

    private final String sessionId;
    private final String token;

    private Lease(String sessionId, String token) {
      this.sessionId = sessionId;
      this.token = token;
    }

    public String sessionId() {
      return sessionId;
    }

    @Override
    public void close() {
      // An expired lease may have been re-taken by someone else; only remove our own token
      if (leases.asMap().remove(sessionId, token)) {
        LOGGER.debug("Released session lease: sessionId={}", sessionId);
      }
    }
  }
}
