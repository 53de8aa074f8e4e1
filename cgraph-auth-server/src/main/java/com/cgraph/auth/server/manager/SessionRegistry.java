package com.cgraph.auth.server.manager;

import com.cgraph.auth.crypto.common.ByteUtils;
import com.cgraph.auth.crypto.common.RandomProvider;
import com.cgraph.auth.server.result.AuthError;
import com.cgraph.auth.server.result.AuthResult;
import com.cgraph.auth.server.store.Session;
import com.cgraph.auth.server.store.SessionStore;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persisted, revocable session handles, independent of the stateless bearer tokens.
 * <p>
 * Anything that must take effect immediately (ban, password change, second factor disabled)
 * goes through {@link #revokeAll(String)}.
 */
@Singleton
public class SessionRegistry {

  private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

  public static final Duration DEFAULT_TTL = Duration.ofDays(30);
  private static final int TOKEN_BYTES = 32;
  private static final Base64.Encoder URL_B64 = Base64.getUrlEncoder().withoutPadding();

  private final SessionStore sessionStore;
  private final RandomProvider randomProvider;
  private final Clock clock;
  private final Duration ttl;

  @Inject
  public SessionRegistry(SessionStore sessionStore, RandomProvider randomProvider, Clock clock,
                         Duration ttl) {
    this.sessionStore = sessionStore;
    this.randomProvider = randomProvider;
    this.clock = clock;
    this.ttl = ttl;
  }

  /**
   * Creates a session for a user.
   *
   * @param userId  owner
   * @param context user agent and client address
   * @return the stored session and its raw token
   */
  public IssuedSession create(String userId, SessionContext context) {
    String rawToken = URL_B64.encodeToString(randomProvider.randomBytes(TOKEN_BYTES));
    Instant now = clock.instant();
    Session session = new Session(UUID.randomUUID().toString(), userId, hash(rawToken),
        context.userAgent(), context.clientIp(), now, now, now.plus(ttl), null);
    sessionStore.insert(session);
    log.debug("Created session id={} for user={}", session.id(), userId);
    return new IssuedSession(session, rawToken);
  }

  /**
   * Looks up a live session by raw token and records the activity.
   *
   * @param rawToken token from the client
   * @return the session, or {@code session_not_found} if unknown, revoked or expired
   */
  public AuthResult<Session> resolve(String rawToken) {
    if (rawToken == null || rawToken.isBlank()) {
      return AuthResult.failure(AuthError.SESSION_NOT_FOUND);
    }
    Instant now = clock.instant();
    Optional<Session> session = sessionStore.findByTokenHash(hash(rawToken));
    if (session.isEmpty() || !session.get().isActive(now)) {
      return AuthResult.failure(AuthError.SESSION_NOT_FOUND);
    }
    sessionStore.touch(session.get().id(), now);
    return AuthResult.success(session.get().withLastActiveAt(now));
  }

  /**
   * Revokes one session. Revoking an already revoked session is a no-op.
   *
   * @param session the session
   */
  public void revoke(Session session) {
    if (sessionStore.markRevoked(session.id(), clock.instant())) {
      log.debug("Revoked session id={}", session.id());
    }
  }

  /**
   * Revokes a session on behalf of its owner.
   *
   * @param userId    caller
   * @param sessionId session to revoke
   * @return {@code session_not_found} unless the caller owns the session
   */
  public AuthResult<Void> revokeOwned(String userId, String sessionId) {
    Optional<Session> session = sessionStore.findById(sessionId);
    if (session.isEmpty() || !session.get().userId().equals(userId)) {
      return AuthResult.failure(AuthError.SESSION_NOT_FOUND);
    }
    revoke(session.get());
    return AuthResult.ok();
  }

  /**
   * Revokes the session a raw token refers to.
   *
   * @param rawToken token from the client
   * @return {@code session_not_found} if the token matches no live session
   */
  public AuthResult<Void> logout(String rawToken) {
    AuthResult<Session> session = resolve(rawToken);
    if (!session.isSuccess()) {
      return session.propagate();
    }
    revoke(session.get());
    return AuthResult.ok();
  }

  /**
   * Revokes every live session of a user.
   *
   * @param userId owner
   * @return the number of sessions revoked
   */
  public int revokeAll(String userId) {
    int count = sessionStore.revokeAllForUser(userId, clock.instant());
    log.info("Revoked all sessions for user={} (count={})", userId, count);
    return count;
  }

  /**
   * Live sessions of a user, most recently active first.
   *
   * @param userId owner
   * @return sessions
   */
  public List<Session> listActive(String userId) {
    Instant now = clock.instant();
    return sessionStore.findByUser(userId).stream()
        .filter(s -> s.isActive(now))
        .sorted(Comparator.comparing(Session::lastActiveAt).reversed())
        .collect(Collectors.toList());
  }

  static String hash(String rawToken) {
    return ByteUtils.sha256Base64(rawToken);
  }
}
