package com.cgraph.auth.server.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link WalletChallengeStore}.
 * <p>
 * <strong>Not suitable for production.</strong> Outstanding challenges are lost on restart,
 * which only forces wallets to request a new one. Challenges that are never consumed are
 * dropped once the retention period has passed, and the store holds at most
 * {@link #MAX_CHALLENGES} addresses.
 */
public class InMemoryWalletChallengeStore implements WalletChallengeStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryWalletChallengeStore.class);

  public static final Duration DEFAULT_RETENTION = Duration.ofHours(1);
  public static final long MAX_CHALLENGES = 100_000;

  private final Cache<String, WalletChallenge> cache;
  private final ConcurrentMap<String, WalletChallenge> challenges;

  public InMemoryWalletChallengeStore() {
    this(DEFAULT_RETENTION, Clock.systemUTC());
  }

  /**
   * @param retention how long an unconsumed challenge is kept, at least the challenge TTL
   * @param clock     time source for expiry
   */
  public InMemoryWalletChallengeStore(Duration retention, Clock clock) {
    this.cache = Caffeine.newBuilder()
        .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
        .executor(Runnable::run)
        .expireAfterWrite(retention)
        .maximumSize(MAX_CHALLENGES)
        .build();
    this.challenges = cache.asMap();
    log.warn("Using in-memory wallet challenge store. Not suitable for production.");
  }

  @Override
  public WalletChallenge getOrRotate(WalletChallenge candidate, Instant staleBefore) {
    return challenges.compute(candidate.address(), (address, existing) ->
        existing == null || existing.isStale(staleBefore) ? candidate : existing);
  }

  @Override
  public Optional<WalletChallenge> find(String address) {
    return Optional.ofNullable(challenges.get(address));
  }

  @Override
  public boolean consume(WalletChallenge challenge) {
    return challenges.remove(challenge.address(), challenge);
  }

  long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }
}
