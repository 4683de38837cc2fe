package com.example.mesh.service.session;

import static com.example.mesh.service.session.TokenMasking.mask;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired records are evicted on {@link #isLive} and by a periodic
 * {@link #purgeExpired() purge}, so records whose token is never presented again do not
 * accumulate. Records are only visible to the process that holds them, so this store
 * suits development and tests, not a multi-process deployment.
 */
@Slf4j
public class InMemorySessionStore implements SessionStore {

  private final ConcurrentHashMap<String, Instant> expiries = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemorySessionStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void register(String token, Duration ttl) {
    expiries.put(token, clock.instant().plus(ttl));
    log.debug("Registered session {} with ttl {}", mask(token), ttl);
  }

  @Override
  public boolean isLive(String token) {
    Instant expiresAt = expiries.get(token);
    if (expiresAt == null) {
      return false;
    }
    if (!expiresAt.isAfter(clock.instant())) {
      expiries.remove(token, expiresAt);
      return false;
    }
    return true;
  }

  @Override
  public void revoke(String token) {
    expiries.remove(token);
    log.debug("Revoked session {}", mask(token));
  }

  /**
   * Removes every record whose expiry has passed.
   *
   * @return the number of records removed
   */
  @Scheduled(
      fixedRateString = "${app.session.purge-interval:PT1M}",
      initialDelayString = "${app.session.purge-interval:PT1M}"
  )
  public int purgeExpired() {
    Instant now = clock.instant();
    int removed = 0;
    for (Map.Entry<String, Instant> entry : expiries.entrySet()) {
      // Conditional remove: a concurrent re-register of the same token survives.
      if (!entry.getValue().isAfter(now) && expiries.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    if (removed > 0) {
      log.debug("Purged {} expired sessions", removed);
    }
    return removed;
  }
}
