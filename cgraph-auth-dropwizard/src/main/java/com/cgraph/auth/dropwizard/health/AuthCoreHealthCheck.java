package com.cgraph.auth.dropwizard.health;

import com.cgraph.auth.crypto.password.Argon2PasswordHasher;
import com.cgraph.auth.server.result.AuthResult;
import com.cgraph.auth.server.token.TokenIssuer;
import com.cgraph.auth.server.token.TokenType;
import com.cgraph.auth.server.token.VerifiedToken;
import com.codahale.metrics.health.HealthCheck;

/**
 * Health check that signs and verifies a throwaway access token, then runs one Argon2id
 * hash-and-verify round with the configured parameters.
 */
public class AuthCoreHealthCheck extends HealthCheck {

  static final String HEALTH_SUBJECT = "health-check";

  private final TokenIssuer tokenIssuer;
  private final Argon2PasswordHasher hasher;

  public AuthCoreHealthCheck(TokenIssuer tokenIssuer, Argon2PasswordHasher hasher) {
    this.tokenIssuer = tokenIssuer;
    this.hasher = hasher;
  }

  @Override
  protected Result check() {
    String token = tokenIssuer.mint(HEALTH_SUBJECT).accessToken();
    AuthResult<VerifiedToken> verified = tokenIssuer.verify(token, TokenType.ACCESS);
    if (!verified.isSuccess() || !HEALTH_SUBJECT.equals(verified.get().subject())) {
      return Result.unhealthy("Signing key cannot verify its own token");
    }
    if (!hasher.selfTest()) {
      return Result.unhealthy("Argon2 reference hash does not verify");
    }
    return Result.healthy("access token ttl=%ds", tokenIssuer.accessTtl().toSeconds());
  }
}
