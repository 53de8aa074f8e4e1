package com.cgraph.auth.server.store;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link RefreshTokenDenylist}. Expired entries are purged every
 * {@value #PURGE_INTERVAL} calls.
 */
public class InMemoryRefreshTokenDenylist implements RefreshTokenDenylist {

  private static final Logger log = LoggerFactory.getLogger(InMemoryRefreshTokenDenylist.class);
  private static final long PURGE_INTERVAL = 1024;

  private final ConcurrentHashMap<String, Instant> spent = new ConcurrentHashMap<>();
  private final AtomicLong calls = new AtomicLong();

  public InMemoryRefreshTokenDenylist() {
    log.warn("Using in-memory refresh token denylist. Not suitable for production.");
  }

  @Override
  public boolean markUsed(String jti, Instant expiresAt, Instant now) {
    if (calls.incrementAndGet() % PURGE_INTERVAL == 0) {
      spent.values().removeIf(expiry -> expiry.isBefore(now));
    }
    return spent.putIfAbsent(jti, expiresAt) == null;
  }

  int size() {
    return spent.size();
  }
}
