package com.cgraph.auth.server.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for sessions.
 * <p>
 * Implementations must be thread-safe. Rows are never deleted; revocation only sets
 * {@link Session#revokedAt()}. Implementations must index sessions by owner so that
 * {@link #revokeAllForUser(String, Instant)} does not scan the whole store.
 */
public interface SessionStore {

  void insert(Session session);

  Optional<Session> findById(String id);

  Optional<Session> findByTokenHash(String tokenHash);

  /**
   * All sessions of a user, revoked and expired ones included.
   *
   * @param userId owner
   * @return sessions in no particular order
   */
  List<Session> findByUser(String userId);

  /**
   * Sets the last-active time of a live session. No-op for revoked or unknown sessions.
   *
   * @param id session id
   * @param at time of activity
   */
  void touch(String id, Instant at);

  /**
   * Sets the revocation time unless already set.
   *
   * @param id session id
   * @param at revocation time
   * @return true if this call revoked the session
   */
  boolean markRevoked(String id, Instant at);

  /**
   * Revokes every unrevoked session of a user.
   *
   * @param userId owner
   * @param at     revocation time
   * @return the number of sessions revoked by this call
   */
  int revokeAllForUser(String userId, Instant at);
}
