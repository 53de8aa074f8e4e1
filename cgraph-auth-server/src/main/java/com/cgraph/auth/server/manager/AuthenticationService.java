package com.cgraph.auth.server.manager;

import com.cgraph.auth.server.result.AuthError;
import com.cgraph.auth.server.result.AuthResult;
import com.cgraph.auth.server.store.Session;
import com.cgraph.auth.server.store.UserRecord;
import com.cgraph.auth.server.store.UserStore;
import com.cgraph.auth.server.token.TokenIssuer;
import com.cgraph.auth.server.token.TokenPair;
import com.cgraph.auth.server.token.TokenType;
import com.cgraph.auth.server.token.VerifiedToken;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for logins and for resolving who a request belongs to.
 * <p>
 * A login runs the first factor, checks the account is active, and either completes
 * (tokens minted, session created) or stops at {@link LoginOutcome.SecondFactorRequired} when
 * the account has a second factor. The second step presents the pending token with a
 * time-based code or a backup code.
 */
@Singleton
public class AuthenticationService {

  private static final Logger log = LoggerFactory.getLogger(AuthenticationService.class);

  private final PasswordAuthenticator passwordAuthenticator;
  private final WalletChallengeAuthenticator walletAuthenticator;
  private final SecondFactorEngine secondFactorEngine;
  private final TokenIssuer tokenIssuer;
  private final SessionRegistry sessionRegistry;
  private final UserStore userStore;
  private final Clock clock;

  @Inject
  public AuthenticationService(PasswordAuthenticator passwordAuthenticator,
                               WalletChallengeAuthenticator walletAuthenticator,
                               SecondFactorEngine secondFactorEngine,
                               TokenIssuer tokenIssuer,
                               SessionRegistry sessionRegistry,
                               UserStore userStore,
                               Clock clock) {
    this.passwordAuthenticator = passwordAuthenticator;
    this.walletAuthenticator = walletAuthenticator;
    this.secondFactorEngine = secondFactorEngine;
    this.tokenIssuer = tokenIssuer;
    this.sessionRegistry = sessionRegistry;
    this.userStore = userStore;
    this.clock = clock;
  }

  /**
   * Runs one login step.
   *
   * @param credential what the client presented
   * @param context    request metadata for the session
   * @return the outcome, or the credential's failure, or {@code account_disabled}
   */
  public AuthResult<LoginOutcome> login(Credential credential, SessionContext context) {
    return credential.accept(new Credential.Visitor<AuthResult<LoginOutcome>>() {
      @Override
      public AuthResult<LoginOutcome> visitPassword(Credential.Password password) {
        return firstFactor(passwordAuthenticator.authenticate(password.email(), password.password()),
            context);
      }

      @Override
      public AuthResult<LoginOutcome> visitWallet(Credential.Wallet wallet) {
        return firstFactor(walletAuthenticator.verify(wallet.address(), wallet.signature()), context);
      }

      @Override
      public AuthResult<LoginOutcome> visitSecondFactorCode(Credential.SecondFactorCode code) {
        return secondFactor(code.pendingToken(),
            userId -> secondFactorEngine.verify(userId, code.code()), context);
      }

      @Override
      public AuthResult<LoginOutcome> visitBackupCode(Credential.BackupCode code) {
        return secondFactor(code.pendingToken(),
            userId -> secondFactorEngine.useBackupCode(userId, code.code()).map(remaining -> null),
            context);
      }
    });
  }

  /**
   * Registers a password account and logs it in.
   *
   * @param email    email
   * @param username optional handle
   * @param password password
   * @param context  request metadata
   * @return the authenticated outcome, or the registration failure
   */
  public AuthResult<LoginOutcome.Authenticated> register(String email, String username,
                                                         String password, SessionContext context) {
    return passwordAuthenticator.register(email, username, password)
        .map(user -> complete(user, context));
  }

  /**
   * Exchanges a refresh token for a new pair.
   *
   * @param refreshToken refresh token
   * @return the pair, or a token failure
   */
  public AuthResult<TokenPair> refresh(String refreshToken) {
    return tokenIssuer.refresh(refreshToken);
  }

  /**
   * Resolves the user behind an access token. Banned or deleted users, and tokens issued before
   * the user's last revocation, fail with {@code token_revoked}.
   *
   * @param accessToken bearer token
   * @return the active user
   */
  public AuthResult<UserRecord> authenticateAccessToken(String accessToken) {
    return tokenIssuer.verifyCurrent(accessToken, TokenType.ACCESS);
  }

  /**
   * Resolves the user behind a raw session token.
   *
   * @param rawSessionToken session token
   * @return the active user, or {@code session_not_found}
   */
  public AuthResult<UserRecord> resolveSession(String rawSessionToken) {
    AuthResult<Session> session = sessionRegistry.resolve(rawSessionToken);
    if (!session.isSuccess()) {
      return session.propagate();
    }
    Optional<UserRecord> user = userStore.findById(session.get().userId());
    if (user.isEmpty() || !user.get().isActive(clock.instant())) {
      return AuthResult.failure(AuthError.SESSION_NOT_FOUND);
    }
    return AuthResult.success(user.get());
  }

  /**
   * Ends the session a raw token refers to.
   *
   * @param rawSessionToken session token
   * @return ok or {@code session_not_found}
   */
  public AuthResult<Void> logout(String rawSessionToken) {
    return sessionRegistry.logout(rawSessionToken);
  }

  private AuthResult<LoginOutcome> firstFactor(AuthResult<UserRecord> verified,
                                               SessionContext context) {
    if (!verified.isSuccess()) {
      return verified.propagate();
    }
    UserRecord user = verified.get();
    if (!user.isActive(clock.instant())) {
      log.debug("Login refused for disabled user={}", user.id());
      return AuthResult.failure(AuthError.ACCOUNT_DISABLED);
    }
    if (user.secondFactorEnabled()) {
      log.debug("Second factor required for user={}", user.id());
      return AuthResult.success(new LoginOutcome.SecondFactorRequired(user.id(),
          tokenIssuer.mintSecondFactorToken(user.id())));
    }
    return AuthResult.success(complete(user, context));
  }

  private AuthResult<LoginOutcome> secondFactor(String pendingToken,
                                                Function<String, AuthResult<Void>> check,
                                                SessionContext context) {
    AuthResult<VerifiedToken> pending = tokenIssuer.verify(pendingToken, TokenType.SECOND_FACTOR);
    if (!pending.isSuccess()) {
      return pending.propagate();
    }
    Optional<UserRecord> user = userStore.findById(pending.get().subject());
    if (user.isEmpty() || !user.get().isActive(clock.instant())) {
      return AuthResult.failure(AuthError.ACCOUNT_DISABLED);
    }
    if (user.get().tokenRevoked(pending.get().issuedAt())) {
      return AuthResult.failure(AuthError.TOKEN_REVOKED);
    }
    AuthResult<Void> checked = check.apply(user.get().id());
    if (!checked.isSuccess()) {
      return checked.propagate();
    }
    return AuthResult.success(complete(user.get(), context));
  }

  private LoginOutcome.Authenticated complete(UserRecord user, SessionContext context) {
    TokenPair tokens = tokenIssuer.mint(user.id());
    IssuedSession session = sessionRegistry.create(user.id(), context);
    log.info("User={} authenticated (session={})", user.id(), session.session().id());
    return new LoginOutcome.Authenticated(user, tokens, session);
  }
}
