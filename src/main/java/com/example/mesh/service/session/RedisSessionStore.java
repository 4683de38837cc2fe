package com.example.mesh.service.session;

import static com.example.mesh.service.session.TokenMasking.mask;

import com.example.mesh.exception.SessionStoreException;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed {@link SessionStore}. Expiry is delegated to Redis key TTLs; each
 * operation is a single round-trip and is not retried here.
 */
@Slf4j
public class RedisSessionStore implements SessionStore {

  private final StringRedisTemplate redisTemplate;
  private final String keyPrefix;

  public RedisSessionStore(StringRedisTemplate redisTemplate, String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.keyPrefix = keyPrefix;
  }

  @Override
  public void register(String token, Duration ttl) {
    try {
      redisTemplate.opsForValue().set(key(token), LIVE_MARKER, ttl);
      log.debug("Registered session {} with ttl {}", mask(token), ttl);
    } catch (RuntimeException e) {
      throw new SessionStoreException("Failed to register session", e);
    }
  }

  @Override
  public boolean isLive(String token) {
    try {
      return Boolean.TRUE.equals(redisTemplate.hasKey(key(token)));
    } catch (RuntimeException e) {
      throw new SessionStoreException("Failed to check session", e);
    }
  }

  @Override
  public void revoke(String token) {
    try {
      Boolean deleted = redisTemplate.delete(key(token));
      log.debug("Revoked session {} (existed: {})", mask(token), deleted);
    } catch (RuntimeException e) {
      throw new SessionStoreException("Failed to revoke session", e);
    }
  }

  private String key(String token) {
    return keyPrefix + token;
  }
}
