package com.cgraph.auth.server.store;

import java.time.Instant;

/**
 * Records refresh tokens that have already been exchanged, so each one works once.
 * <p>
 * Implementations must be thread-safe and {@link #markUsed} must be atomic. Entries only need
 * to live until the token's own expiry.
 */
public interface RefreshTokenDenylist {

  /**
   * Marks a refresh token id as spent.
   *
   * @param jti       token id
   * @param expiresAt token expiry, after which the entry may be forgotten
   * @param now       current time
   * @return true if the id was not spent before this call
   */
  boolean markUsed(String jti, Instant expiresAt, Instant now);
}
