package com.cgraph.auth.server.token;

import java.time.Duration;

/**
 * Immutable token configuration, loaded once at startup.
 *
 * @param secret          HMAC-SHA256 signing key, at least 32 bytes
 * @param issuer          {@code iss} claim
 * @param accessTtl       access token lifetime
 * @param refreshTtl      refresh token lifetime
 * @param secondFactorTtl lifetime of the pending second-factor token
 */
public record TokenSettings(byte[] secret, String issuer, Duration accessTtl, Duration refreshTtl,
                            Duration secondFactorTtl) {

  public static final Duration DEFAULT_ACCESS_TTL = Duration.ofMinutes(15);
  public static final Duration DEFAULT_REFRESH_TTL = Duration.ofDays(30);
  public static final Duration DEFAULT_SECOND_FACTOR_TTL = Duration.ofMinutes(5);

  public TokenSettings {
    if (secret == null || secret.length < 32) {
      throw new IllegalArgumentException("Signing secret must be at least 32 bytes");
    }
    if (accessTtl.compareTo(refreshTtl) >= 0) {
      throw new IllegalArgumentException("Access token TTL must be shorter than refresh token TTL");
    }
    secret = secret.clone();
  }

  @Override
  public byte[] secret() {
    return secret.clone();
  }
}
