package com.cgraph.auth.server.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by {@link ConcurrentHashMap}s.
 * <p>
 * All sessions are lost on server restart. Suitable for development and integration testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, Session> byId = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, String> hashIndex = new ConcurrentHashMap<>();
  // Reverse index: userId → session ids, kept in sync with byId.
  private final ConcurrentHashMap<String, Set<String>> userToSessions = new ConcurrentHashMap<>();

  public InMemorySessionStore() {
    log.warn("Using in-memory session store. Not suitable for production.");
  }

  @Override
  public void insert(Session session) {
    if (hashIndex.putIfAbsent(session.tokenHash(), session.id()) != null) {
      throw new StoreException("Duplicate session token hash");
    }
    byId.put(session.id(), session);
    userToSessions.computeIfAbsent(session.userId(), k -> ConcurrentHashMap.newKeySet()).add(session.id());
    log.debug("Stored session id={} for user={}", session.id(), session.userId());
  }

  @Override
  public Optional<Session> findById(String id) {
    return Optional.ofNullable(byId.get(id));
  }

  @Override
  public Optional<Session> findByTokenHash(String tokenHash) {
    return Optional.ofNullable(hashIndex.get(tokenHash)).map(byId::get);
  }

  @Override
  public List<Session> findByUser(String userId) {
    Set<String> ids = userToSessions.getOrDefault(userId, Set.of());
    return ids.stream().map(byId::get).filter(s -> s != null).collect(Collectors.toList());
  }

  @Override
  public void touch(String id, Instant at) {
    byId.computeIfPresent(id, (k, s) -> s.revokedAt() == null ? s.withLastActiveAt(at) : s);
  }

  @Override
  public boolean markRevoked(String id, Instant at) {
    AtomicBoolean revoked = new AtomicBoolean(false);
    byId.computeIfPresent(id, (k, s) -> {
      if (s.revokedAt() != null) {
        return s;
      }
      revoked.set(true);
      return s.withRevokedAt(at);
    });
    return revoked.get();
  }

  @Override
  public int revokeAllForUser(String userId, Instant at) {
    int count = 0;
    for (String id : userToSessions.getOrDefault(userId, Set.of())) {
      if (markRevoked(id, at)) {
        count++;
      }
    }
    log.debug("Revoked {} session(s) for user={}", count, userId);
    return count;
  }
}
