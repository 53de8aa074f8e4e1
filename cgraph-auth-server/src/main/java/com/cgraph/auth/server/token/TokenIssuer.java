package com.cgraph.auth.server.token;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.cgraph.auth.server.result.AuthError;
import com.cgraph.auth.server.result.AuthResult;
import com.cgraph.auth.server.store.RefreshTokenDenylist;
import com.cgraph.auth.server.store.UserRecord;
import com.cgraph.auth.server.store.UserStore;
import com.cgraph.auth.server.store.UserUpdates;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies signed bearer tokens.
 * <p>
 * Tokens are HMAC-SHA256 JWTs carrying {@code sub}, {@code typ}, {@code jti}, {@code iss},
 * {@code iat} and {@code exp}. Refresh tokens are single use: the {@code jti} of every exchanged
 * refresh token goes into a {@link RefreshTokenDenylist}.
 * <p>
 * Every token is also checked against its subject: the user must still be active, and the token
 * must not predate the user's {@link UserRecord#tokensRevokedBefore()} cutoff. Password changes,
 * second-factor removal, bans and refresh-token reuse move that cutoff forward.
 */
@Singleton
public class TokenIssuer {

  private static final Logger log = LoggerFactory.getLogger(TokenIssuer.class);
  static final String TYPE_CLAIM = "typ";

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final TokenSettings settings;
  private final RefreshTokenDenylist denylist;
  private final UserStore userStore;
  private final Clock clock;

  /**
   * Creates a new TokenIssuer.
   *
   * @param settings  signing key, issuer and lifetimes
   * @param denylist  spent refresh token ids
   * @param userStore resolves token subjects and records revocations
   * @param clock     time source for issuing and verifying
   */
  @Inject
  public TokenIssuer(TokenSettings settings, RefreshTokenDenylist denylist, UserStore userStore,
                     Clock clock) {
    this.settings = settings;
    this.algorithm = Algorithm.HMAC256(settings.secret());
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm)
        .withIssuer(settings.issuer())).build(clock);
    this.denylist = denylist;
    this.userStore = userStore;
    this.clock = clock;
  }

  /**
   * Mints an access and refresh token for a principal.
   *
   * @param userId the principal's id
   * @return the pair
   */
  public TokenPair mint(String userId) {
    String access = sign(userId, TokenType.ACCESS, settings.accessTtl());
    String refresh = sign(userId, TokenType.REFRESH, settings.refreshTtl());
    log.debug("Minted token pair for user={}", userId);
    return new TokenPair(access, refresh, settings.accessTtl().toSeconds());
  }

  /**
   * Mints the short-lived token that carries a half-finished login to the second-factor step.
   *
   * @param userId the user who passed the first factor
   * @return signed token of type {@code second_factor}
   */
  public String mintSecondFactorToken(String userId) {
    return sign(userId, TokenType.SECOND_FACTOR, settings.secondFactorTtl());
  }

  /**
   * Verifies signature, issuer, expiry and type.
   *
   * @param token    compact JWT
   * @param expected type the caller accepts
   * @return the claims, or {@code token_expired}, {@code token_malformed} or
   *     {@code token_wrong_type}
   */
  public AuthResult<VerifiedToken> verify(String token, TokenType expected) {
    if (token == null || token.isBlank()) {
      return AuthResult.failure(AuthError.TOKEN_MALFORMED);
    }
    DecodedJWT decoded;
    try {
      decoded = verifier.verify(token);
    } catch (TokenExpiredException e) {
      log.debug("Token expired: {}", e.getMessage());
      return AuthResult.failure(AuthError.TOKEN_EXPIRED);
    } catch (JWTVerificationException e) {
      log.debug("Token verification failed: {}", e.getMessage());
      return AuthResult.failure(AuthError.TOKEN_MALFORMED);
    }
    String type = decoded.getClaim(TYPE_CLAIM).asString();
    if (!expected.claim().equals(type)) {
      log.debug("Token type {} presented where {} expected", type, expected.claim());
      return AuthResult.failure(AuthError.TOKEN_WRONG_TYPE);
    }
    if (decoded.getSubject() == null || decoded.getId() == null
        || decoded.getIssuedAtAsInstant() == null) {
      return AuthResult.failure(AuthError.TOKEN_MALFORMED);
    }
    return AuthResult.success(new VerifiedToken(decoded.getSubject(), decoded.getId(), expected,
        decoded.getIssuedAtAsInstant(), decoded.getExpiresAtAsInstant()));
  }

  /**
   * Verifies a token and resolves its subject, which must be active and must not have revoked
   * the token since it was issued.
   *
   * @param token    compact JWT
   * @param expected type the caller accepts
   * @return the user, or a verification error, or {@code token_revoked}
   */
  public AuthResult<UserRecord> verifyCurrent(String token, TokenType expected) {
    return verify(token, expected).flatMap(this::currentSubject);
  }

  /**
   * Verifies an access token.
   *
   * @param token compact JWT
   * @return the subject user id
   */
  public AuthResult<String> verifyAccess(String token) {
    return verifyCurrent(token, TokenType.ACCESS).map(UserRecord::id);
  }

  /**
   * Exchanges a refresh token for a new pair. The presented token is spent. Presenting it again
   * means it leaked, so every token the user holds is revoked and the call fails with
   * {@code token_revoked}. A refresh for a banned or deleted subject fails the same way.
   *
   * @param refreshToken compact JWT of type {@code refresh}
   * @return a new pair
   */
  public AuthResult<TokenPair> refresh(String refreshToken) {
    AuthResult<VerifiedToken> verified = verify(refreshToken, TokenType.REFRESH);
    if (!verified.isSuccess()) {
      return verified.propagate();
    }
    VerifiedToken token = verified.get();
    AuthResult<UserRecord> user = currentSubject(token);
    if (!user.isSuccess()) {
      return user.propagate();
    }
    if (!denylist.markUsed(token.jti(), token.expiresAt(), clock.instant())) {
      log.warn("Refresh token reuse detected for user={} jti={}, revoking all tokens",
          token.subject(), token.jti());
      revokeAll(token.subject());
      return AuthResult.failure(AuthError.TOKEN_REVOKED);
    }
    return AuthResult.success(mint(token.subject()));
  }

  /**
   * Revokes every token issued to the user up to now.
   *
   * @param userId the user
   */
  public void revokeAll(String userId) {
    Instant now = clock.instant();
    UserUpdates.apply(userStore, userId, user -> {
      UserRecord updated = user.withTokensRevokedAt(now);
      return UserUpdates.Step.write(updated, updated);
    });
    log.info("Revoked all tokens for user={}", userId);
  }

  public Duration accessTtl() {
    return settings.accessTtl();
  }

  private AuthResult<UserRecord> currentSubject(VerifiedToken token) {
    Optional<UserRecord> user = userStore.findById(token.subject());
    if (user.isEmpty() || !user.get().isActive(clock.instant())) {
      log.debug("Token refused for inactive subject={}", token.subject());
      return AuthResult.failure(AuthError.TOKEN_REVOKED);
    }
    if (user.get().tokenRevoked(token.issuedAt())) {
      log.debug("Token issued at {} predates revocation for user={}", token.issuedAt(),
          token.subject());
      return AuthResult.failure(AuthError.TOKEN_REVOKED);
    }
    return AuthResult.success(user.get());
  }

  private String sign(String subject, TokenType type, Duration ttl) {
    Instant now = clock.instant();
    return JWT.create()
        .withIssuer(settings.issuer())
        .withJWTId(UUID.randomUUID().toString())
        .withSubject(subject)
        .withClaim(TYPE_CLAIM, type.claim())
        .withIssuedAt(now)
        .withExpiresAt(now.plus(ttl))
        .sign(algorithm);
  }
}
