package com.cgraph.auth.server.breach;

import com.cgraph.auth.server.result.AuthError;
import com.cgraph.auth.server.result.AuthResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.bouncycastle.crypto.digests.SHA1Digest;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort password breach checking.
 * <p>
 * Lookups are cached by password hash. An unavailable breach service counts as "no finding" and
 * never fails the caller. Findings are logged at most once per user per cooldown window, and
 * on-demand checks are limited to one per user per window.
 * <p>
 * All three caches are bounded Caffeine caches that expire on the injected clock.
 */
public class BreachCheckService {

  private static final Logger log = LoggerFactory.getLogger(BreachCheckService.class);

  static final long MAX_CACHED_LOOKUPS = 10_000;
  static final long MAX_TRACKED_USERS = 100_000;

  private final PasswordBreachChecker checker;
  private final boolean enabled;
  private final Executor executor;
  private final Clock clock;

  private final Cache<String, BreachStatus> lookups;
  private final Cache<String, Instant> lastFindingLogged;
  private final Cache<String, Instant> lastOnDemandCheck;

  /**
   * Creates the service.
   *
   * @param checker  breach corpus client
   * @param enabled  when false every lookup reports clean without network access
   * @param executor runs post-registration checks off the request thread
   * @param clock    time source for cache and cooldowns
   * @param cacheTtl how long a lookup result is reused
   * @param cooldown per-user window for finding logs and on-demand checks
   */
  public BreachCheckService(PasswordBreachChecker checker, boolean enabled, Executor executor,
                            Clock clock, Duration cacheTtl, Duration cooldown) {
    this.checker = checker;
    this.enabled = enabled;
    this.executor = executor;
    this.clock = clock;
    Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
    this.lookups = newCache(ticker, cacheTtl, MAX_CACHED_LOOKUPS);
    this.lastFindingLogged = newCache(ticker, cooldown, MAX_TRACKED_USERS);
    this.lastOnDemandCheck = newCache(ticker, cooldown, MAX_TRACKED_USERS);
    if (!enabled) {
      log.info("Password breach checking disabled");
    }
  }

  /**
   * Looks a password up, using the cache when fresh.
   *
   * @param password plaintext password
   * @return the finding, {@link BreachStatus#CLEAN} if the service is unavailable
   */
  public BreachStatus check(String password) {
    if (!enabled) {
      return BreachStatus.CLEAN;
    }
    String sha1 = sha1Hex(password);
    BreachStatus cached = lookups.getIfPresent(sha1);
    if (cached != null) {
      return cached;
    }
    try {
      BreachStatus status = checker.check(sha1);
      lookups.put(sha1, status);
      return status;
    } catch (BreachCheckException e) {
      log.warn("Password breach check unavailable, treating as no finding: {}", e.getMessage());
      return BreachStatus.CLEAN;
    }
  }

  /**
   * Schedules a check of a newly chosen password. Never blocks and never fails the caller.
   *
   * @param userId   the new user
   * @param password the password they chose
   */
  public void checkInBackground(String userId, String password) {
    if (!enabled) {
      return;
    }
    try {
      executor.execute(() -> {
        BreachStatus status = check(password);
        if (status.breached()) {
          logFinding(userId, status);
        }
      });
    } catch (RejectedExecutionException e) {
      log.warn("Breach check for user={} not scheduled: {}", userId, e.getMessage());
    }
  }

  /**
   * On-demand exposure check, limited to one per user per cooldown window.
   *
   * @param userId   caller
   * @param password password to check
   * @return the finding, or {@code rate_limited} inside the window
   */
  public AuthResult<BreachStatus> checkExposure(String userId, String password) {
    if (!claimWindow(lastOnDemandCheck, userId)) {
      return AuthResult.failure(AuthError.RATE_LIMITED);
    }
    BreachStatus status = check(password);
    if (status.breached()) {
      logFinding(userId, status);
    }
    return AuthResult.success(status);
  }

  private void logFinding(String userId, BreachStatus status) {
    if (claimWindow(lastFindingLogged, userId)) {
      log.warn("Password for user={} appears in {} known breaches", userId, status.occurrences());
    }
  }

  private boolean claimWindow(Cache<String, Instant> windows, String userId) {
    return windows.asMap().putIfAbsent(userId, clock.instant()) == null;
  }

  long cachedLookups() {
    lookups.cleanUp();
    return lookups.estimatedSize();
  }

  private static <V> Cache<String, V> newCache(Ticker ticker, Duration ttl, long maximumSize) {
    return Caffeine.newBuilder()
        .ticker(ticker)
        .executor(Runnable::run)
        .expireAfterWrite(ttl)
        .maximumSize(maximumSize)
        .build();
  }

  static String sha1Hex(String password) {
    SHA1Digest digest = new SHA1Digest();
    byte[] input = password.getBytes(StandardCharsets.UTF_8);
    digest.update(input, 0, input.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return Hex.toHexString(out).toUpperCase(Locale.ROOT);
  }
}
