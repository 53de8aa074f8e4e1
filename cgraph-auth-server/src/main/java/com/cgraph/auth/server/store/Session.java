package com.cgraph.auth.server.store;

import java.time.Instant;

/**
 * A persisted session handle. The raw token is never stored, only its hash.
 *
 * @param id           session id
 * @param userId       owner
 * @param tokenHash    Base64 SHA-256 of the raw token
 * @param userAgent    user agent at creation, may be null
 * @param ipAddress    client address at creation, may be null
 * @param createdAt    creation time
 * @param lastActiveAt last resolution time
 * @param expiresAt    natural expiry
 * @param revokedAt    revocation time, null while live
 */
public record Session(
    String id,
    String userId,
    String tokenHash,
    String userAgent,
    String ipAddress,
    Instant createdAt,
    Instant lastActiveAt,
    Instant expiresAt,
    Instant revokedAt) {

  public boolean isActive(Instant now) {
    return revokedAt == null && expiresAt.isAfter(now);
  }

  public Session withLastActiveAt(Instant at) {
    return new Session(id, userId, tokenHash, userAgent, ipAddress, createdAt, at, expiresAt, revokedAt);
  }

  public Session withRevokedAt(Instant at) {
    return new Session(id, userId, tokenHash, userAgent, ipAddress, createdAt, lastActiveAt, expiresAt, at);
  }
}
