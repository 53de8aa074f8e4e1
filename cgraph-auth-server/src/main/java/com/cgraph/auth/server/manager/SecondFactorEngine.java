package com.cgraph.auth.server.manager;

import com.cgraph.auth.crypto.common.RandomProvider;
import com.cgraph.auth.crypto.seal.SecretSealer;
import com.cgraph.auth.crypto.totp.BackupCodes;
import com.cgraph.auth.crypto.totp.Totp;
import com.cgraph.auth.server.result.AuthError;
import com.cgraph.auth.server.result.AuthResult;
import com.cgraph.auth.server.store.StoreException;
import com.cgraph.auth.server.store.UserRecord;
import com.cgraph.auth.server.store.UserStore;
import com.cgraph.auth.server.store.UserUpdates;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Time-based second factor with single-use backup codes.
 * <p>
 * States: disabled, pending setup (material handed out, nothing stored), enabled. The secret is
 * stored only after the user proves with a live code that they copied it. It is kept sealed and
 * the backup codes are kept as hashes.
 * <p>
 * Every change to the stored factor is a compare-and-set on the user record, so two
 * simultaneous submissions of the same backup code cannot both succeed.
 */
@Singleton
public class SecondFactorEngine {

  private static final Logger log = LoggerFactory.getLogger(SecondFactorEngine.class);

  public static final int DEFAULT_BACKUP_CODE_COUNT = 10;

  private final UserStore userStore;
  private final SessionRegistry sessionRegistry;
  private final SecretSealer sealer;
  private final Totp totp;
  private final BackupCodes backupCodes;
  private final RandomProvider randomProvider;
  private final Clock clock;
  private final String issuer;
  private final int backupCodeCount;

  @Inject
  public SecondFactorEngine(UserStore userStore, SessionRegistry sessionRegistry, SecretSealer sealer,
                            Totp totp, RandomProvider randomProvider, Clock clock, String issuer,
                            int backupCodeCount) {
    this.userStore = userStore;
    this.sessionRegistry = sessionRegistry;
    this.sealer = sealer;
    this.totp = totp;
    this.backupCodes = new BackupCodes(randomProvider);
    this.randomProvider = randomProvider;
    this.clock = clock;
    this.issuer = issuer;
    this.backupCodeCount = backupCodeCount;
  }

  /**
   * Generates a candidate secret and backup codes without storing anything.
   *
   * @param userId the user
   * @return the material, or {@code already_enabled}
   */
  public AuthResult<SecondFactorSetup> setup(String userId) {
    UserRecord user = load(userId);
    if (user.secondFactorEnabled()) {
      return AuthResult.failure(AuthError.ALREADY_ENABLED);
    }
    byte[] secret = randomProvider.randomBytes(Totp.SECRET_BYTES);
    return AuthResult.success(new SecondFactorSetup(
        Totp.encodeSecret(secret),
        totp.provisioningUri(issuer, user.accountLabel(), secret),
        backupCodes.generate(backupCodeCount)));
  }

  /**
   * Stores the candidate secret and backup codes once {@code code} proves the secret was copied.
   *
   * @param userId       the user
   * @param code         current code from the candidate secret
   * @param secretBase32 candidate secret from {@link #setup}
   * @param codes        candidate backup codes from {@link #setup}
   * @return the updated user, or {@code already_enabled}, {@code invalid_code},
   *     {@code invalid_request}
   */
  public AuthResult<UserRecord> enable(String userId, String code, String secretBase32,
                                       List<String> codes) {
    Optional<byte[]> secret = decodeSecret(secretBase32);
    Optional<List<String>> hashes = hashBackupCodes(codes);
    if (secret.isEmpty() || hashes.isEmpty()) {
      return AuthResult.failure(AuthError.INVALID_REQUEST);
    }
    if (load(userId).secondFactorEnabled()) {
      return AuthResult.failure(AuthError.ALREADY_ENABLED);
    }
    if (!totp.verify(secret.get(), code, clock.instant())) {
      log.debug("Second factor enable rejected for user={}", userId);
      return AuthResult.failure(AuthError.INVALID_CODE);
    }
    String sealed = sealer.seal(secret.get());
    AuthResult<UserRecord> result = UserUpdates.apply(userStore, userId, user -> {
      if (user.secondFactorEnabled()) {
        return UserUpdates.Step.stop(AuthResult.failure(AuthError.ALREADY_ENABLED));
      }
      UserRecord updated = user.withSecondFactor(sealed, hashes.get(), clock.instant());
      return UserUpdates.Step.write(updated, AuthResult.success(updated));
    });
    if (result.isSuccess()) {
      log.info("Second factor enabled for user={}", userId);
    }
    return result;
  }

  /**
   * Checks a time-based code against the stored secret.
   *
   * @param userId the user
   * @param code   submitted code
   * @return ok, {@code totp_not_enabled} or {@code invalid_code}
   */
  public AuthResult<Void> verify(String userId, String code) {
    UserRecord user = load(userId);
    if (!user.secondFactorEnabled()) {
      return AuthResult.failure(AuthError.TOTP_NOT_ENABLED);
    }
    if (!codeMatches(user, code)) {
      log.debug("Second factor code rejected for user={}", userId);
      return AuthResult.failure(AuthError.INVALID_CODE);
    }
    return AuthResult.ok();
  }

  /**
   * Turns the second factor off with either a live code or one unused backup code, then revokes
   * every session and token of the user.
   *
   * @param userId the user
   * @param code   time-based code or backup code
   * @return backup codes left at the moment of disabling (one fewer if a backup code was spent),
   *     or {@code totp_not_enabled}, {@code invalid_code}
   */
  public AuthResult<Integer> disable(String userId, String code) {
    AuthResult<Integer> result = UserUpdates.apply(userStore, userId, user -> {
      if (!user.secondFactorEnabled()) {
        return UserUpdates.Step.stop(AuthResult.failure(AuthError.TOTP_NOT_ENABLED));
      }
      int remaining;
      if (codeMatches(user, code)) {
        remaining = user.backupCodeHashes().size();
      } else {
        Optional<List<String>> afterUse = spendBackupCode(user, code);
        if (afterUse.isEmpty()) {
          return UserUpdates.Step.stop(AuthResult.failure(AuthError.INVALID_CODE));
        }
        remaining = afterUse.get().size();
      }
      return UserUpdates.Step.write(user.withoutSecondFactor().withTokensRevokedAt(clock.instant()),
          AuthResult.success(remaining));
    });
    if (result.isSuccess()) {
      log.info("Second factor disabled for user={}", userId);
      sessionRegistry.revokeAll(userId);
    } else {
      log.debug("Second factor disable rejected for user={}: {}", userId, result.getError().code());
    }
    return result;
  }

  /**
   * Replaces the whole backup-code set. Requires a live time-based code.
   *
   * @param userId the user
   * @param code   time-based code
   * @return the new plaintext codes, or {@code totp_not_enabled}, {@code invalid_code}
   */
  public AuthResult<List<String>> regenerateBackupCodes(String userId, String code) {
    List<String> fresh = backupCodes.generate(backupCodeCount);
    List<String> hashes = BackupCodes.hashAll(fresh);
    AuthResult<List<String>> result = UserUpdates.apply(userStore, userId, user -> {
      if (!user.secondFactorEnabled()) {
        return UserUpdates.Step.stop(AuthResult.failure(AuthError.TOTP_NOT_ENABLED));
      }
      if (!codeMatches(user, code)) {
        return UserUpdates.Step.stop(AuthResult.failure(AuthError.INVALID_CODE));
      }
      return UserUpdates.Step.write(user.withBackupCodeHashes(hashes), AuthResult.success(fresh));
    });
    if (result.isSuccess()) {
      log.info("Backup codes regenerated for user={}", userId);
    }
    return result;
  }

  /**
   * Spends one backup code.
   *
   * @param userId the user
   * @param code   backup code in any case, dash optional
   * @return codes left, or {@code totp_not_enabled}, {@code no_backup_codes}, {@code invalid_code}
   */
  public AuthResult<Integer> useBackupCode(String userId, String code) {
    AuthResult<Integer> result = UserUpdates.apply(userStore, userId, user -> {
      if (!user.secondFactorEnabled()) {
        return UserUpdates.Step.stop(AuthResult.failure(AuthError.TOTP_NOT_ENABLED));
      }
      if (user.backupCodeHashes().isEmpty()) {
        return UserUpdates.Step.stop(AuthResult.failure(AuthError.NO_BACKUP_CODES));
      }
      Optional<List<String>> afterUse = spendBackupCode(user, code);
      if (afterUse.isEmpty()) {
        return UserUpdates.Step.stop(AuthResult.failure(AuthError.INVALID_CODE));
      }
      return UserUpdates.Step.write(user.withBackupCodeHashes(afterUse.get()),
          AuthResult.success(afterUse.get().size()));
    });
    if (result.isSuccess()) {
      log.info("Backup code used for user={} (remaining={})", userId, result.get());
    }
    return result;
  }

  private boolean codeMatches(UserRecord user, String code) {
    return totp.verify(sealer.open(user.totpSecretSealed()), code, clock.instant());
  }

  private static Optional<List<String>> spendBackupCode(UserRecord user, String code) {
    Optional<String> canonical = BackupCodes.normalize(code);
    if (canonical.isEmpty()) {
      return Optional.empty();
    }
    List<String> remaining = new ArrayList<>(user.backupCodeHashes());
    if (!remaining.remove(BackupCodes.hash(canonical.get()))) {
      return Optional.empty();
    }
    return Optional.of(remaining);
  }

  private static Optional<byte[]> decodeSecret(String secretBase32) {
    if (secretBase32 == null || secretBase32.isBlank()) {
      return Optional.empty();
    }
    try {
      byte[] secret = Totp.decodeSecret(secretBase32);
      return secret.length == Totp.SECRET_BYTES ? Optional.of(secret) : Optional.empty();
    } catch (RuntimeException e) {
      log.debug("Rejected undecodable second factor secret: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private static Optional<List<String>> hashBackupCodes(List<String> codes) {
    if (codes == null || codes.isEmpty()) {
      return Optional.empty();
    }
    List<String> hashes = new ArrayList<>(codes.size());
    for (String code : codes) {
      Optional<String> canonical = BackupCodes.normalize(code);
      if (canonical.isEmpty()) {
        return Optional.empty();
      }
      hashes.add(BackupCodes.hash(canonical.get()));
    }
    return Optional.of(hashes);
  }

  private UserRecord load(String userId) {
    return userStore.findById(userId)
        .orElseThrow(() -> new StoreException("User not found: " + userId));
  }
}
