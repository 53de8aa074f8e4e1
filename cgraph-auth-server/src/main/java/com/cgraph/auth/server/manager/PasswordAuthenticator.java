package com.cgraph.auth.server.manager;

import com.cgraph.auth.crypto.password.Argon2PasswordHasher;
import com.cgraph.auth.server.breach.BreachCheckService;
import com.cgraph.auth.server.result.AuthError;
import com.cgraph.auth.server.result.AuthResult;
import com.cgraph.auth.server.store.UserRecord;
import com.cgraph.auth.server.store.UserStore;
import com.cgraph.auth.server.store.UserUpdates;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers and verifies email and password credentials.
 * <p>
 * <strong>Enumeration resistance:</strong> {@link #authenticate} answers
 * {@code invalid_credentials} for an unknown email and for a wrong password alike, and runs a
 * full Argon2id verification in both cases so the two are not distinguishable by latency.
 */
@Singleton
public class PasswordAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(PasswordAuthenticator.class);

  static final int MIN_PASSWORD_LENGTH = 8;
  private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

  private final UserStore userStore;
  private final Argon2PasswordHasher hasher;
  private final BreachCheckService breachCheckService;
  private final SessionRegistry sessionRegistry;
  private final Clock clock;

  @Inject
  public PasswordAuthenticator(UserStore userStore, Argon2PasswordHasher hasher,
                               BreachCheckService breachCheckService,
                               SessionRegistry sessionRegistry, Clock clock) {
    this.userStore = userStore;
    this.hasher = hasher;
    this.breachCheckService = breachCheckService;
    this.sessionRegistry = sessionRegistry;
    this.clock = clock;
  }

  /**
   * Registers a new account. The breach check runs afterwards in the background.
   *
   * @param email    email, normalized to lower case
   * @param username optional unique handle
   * @param password plaintext password
   * @return the new user, {@code invalid_request} for a bad email or short password, or
   *     {@code already_registered}
   */
  public AuthResult<UserRecord> register(String email, String username, String password) {
    String normalized = normalizeEmail(email);
    if (normalized == null || !EMAIL.matcher(normalized).matches() || !acceptablePassword(password)) {
      return AuthResult.failure(AuthError.INVALID_REQUEST);
    }
    String handle = username == null || username.isBlank() ? null : username.strip();
    if (userStore.findByEmail(normalized).isPresent()) {
      return AuthResult.failure(AuthError.ALREADY_REGISTERED);
    }
    UserRecord user = UserRecord.withPassword(UUID.randomUUID().toString(), normalized, handle,
        hasher.hash(password), clock.instant());
    if (!userStore.insert(user)) {
      return AuthResult.failure(AuthError.ALREADY_REGISTERED);
    }
    log.info("Registered user={}", user.id());
    breachCheckService.checkInBackground(user.id(), password);
    return AuthResult.success(user);
  }

  /**
   * Verifies an email and password.
   *
   * @param email    email, any case
   * @param password plaintext password
   * @return the user, or {@code invalid_credentials}
   */
  public AuthResult<UserRecord> authenticate(String email, String password) {
    String candidate = password == null ? "" : password;
    String normalized = normalizeEmail(email);
    Optional<UserRecord> user = normalized == null ? Optional.empty() : userStore.findByEmail(normalized);
    if (user.isEmpty() || user.get().passwordHash() == null) {
      hasher.verifyAgainstReference(candidate);
      log.debug("Password login failed: no password credential");
      return AuthResult.failure(AuthError.INVALID_CREDENTIALS);
    }
    if (!hasher.verify(candidate, user.get().passwordHash())) {
      log.debug("Password login failed for user={}", user.get().id());
      return AuthResult.failure(AuthError.INVALID_CREDENTIALS);
    }
    return AuthResult.success(user.get());
  }

  /**
   * Replaces the password after checking the current one, then revokes every session and every
   * token issued so far.
   *
   * @param userId          caller
   * @param currentPassword password being replaced
   * @param newPassword     replacement
   * @return the updated user, {@code invalid_credentials} or {@code invalid_request}
   */
  public AuthResult<UserRecord> changePassword(String userId, String currentPassword,
                                               String newPassword) {
    if (!acceptablePassword(newPassword)) {
      return AuthResult.failure(AuthError.INVALID_REQUEST);
    }
    String candidate = currentPassword == null ? "" : currentPassword;
    AuthResult<UserRecord> result = UserUpdates.apply(userStore, userId, user -> {
      if (user.passwordHash() == null || !hasher.verify(candidate, user.passwordHash())) {
        return UserUpdates.Step.stop(AuthResult.failure(AuthError.INVALID_CREDENTIALS));
      }
      UserRecord updated = user.withPasswordHash(hasher.hash(newPassword))
          .withTokensRevokedAt(clock.instant());
      return UserUpdates.Step.write(updated, AuthResult.success(updated));
    });
    if (result.isSuccess()) {
      log.info("Password changed for user={}", userId);
      sessionRegistry.revokeAll(userId);
      breachCheckService.checkInBackground(userId, newPassword);
    }
    return result;
  }

  private static boolean acceptablePassword(String password) {
    return password != null && password.length() >= MIN_PASSWORD_LENGTH;
  }

  static String normalizeEmail(String email) {
    if (email == null || email.isBlank()) {
      return null;
    }
    return email.strip().toLowerCase(Locale.ROOT);
  }
}
