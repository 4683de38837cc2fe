package com.example.mesh.service.session;

import java.time.Duration;

/**
 * Shared store of live session records, keyed by the exact token string.
 * <p>
 * Implementations must be thread-safe. Every method either completes or throws
 * {@link com.example.mesh.exception.SessionStoreException}; a store failure is
 * never reported as "not live" or "live".
 */
public interface SessionStore {

  /** Value written for every live session record. */
  String LIVE_MARKER = "valid";

  /**
   * Writes a session record that the store expires after {@code ttl}.
   * An existing record for the same token is overwritten.
   *
   * @param token session token
   * @param ttl   time-to-live enforced by the store
   */
  void register(String token, Duration ttl);

  /**
   * @param token session token
   * @return true while the record exists and has not expired
   */
  boolean isLive(String token);

  /**
   * Deletes the record so the token stops being accepted before it expires.
   * Revoking an unknown token is a no-op.
   *
   * @param token session token
   */
  void revoke(String token);
}
