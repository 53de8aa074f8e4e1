package com.cgraph.auth.server.store;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Persisted identity root. Immutable; changes go through the {@code with*} copies and
 * {@link UserStore#compareAndSet(UserRecord, UserRecord)}.
 *
 * @param id               opaque user id
 * @param email            lower-case email, null for wallet-only accounts
 * @param username         unique handle, may be null
 * @param passwordHash     Argon2id PHC string, null for wallet-only accounts
 * @param walletAddress    lower-case {@code 0x} address, may be null
 * @param totpSecretSealed sealed second-factor secret, null unless enabled
 * @param backupCodeHashes hashes of unused backup codes
 * @param totpEnabledAt    when the second factor was enabled, null if disabled
 * @param bannedAt         ban time, null if not banned
 * @param bannedUntil      ban end, null for a permanent ban
 * @param deletedAt        soft-delete time
 * @param tokensRevokedBefore tokens issued before this second are dead, null if never revoked
 * @param createdAt        creation time
 * @param version          optimistic concurrency version, managed by the store
 */
public record UserRecord(
    String id,
    String email,
    String username,
    String passwordHash,
    String walletAddress,
    String totpSecretSealed,
    List<String> backupCodeHashes,
    Instant totpEnabledAt,
    Instant bannedAt,
    Instant bannedUntil,
    Instant deletedAt,
    Instant tokensRevokedBefore,
    Instant createdAt,
    long version) {

  public UserRecord {
    backupCodeHashes = backupCodeHashes == null ? List.of() : List.copyOf(backupCodeHashes);
  }

  public static UserRecord withPassword(String id, String email, String username,
                                        String passwordHash, Instant now) {
    return new UserRecord(id, email, username, passwordHash, null, null, List.of(),
        null, null, null, null, null, now, 0);
  }

  public static UserRecord withWallet(String id, String walletAddress, String username, Instant now) {
    return new UserRecord(id, null, username, null, walletAddress, null, List.of(),
        null, null, null, null, null, now, 0);
  }

  public boolean secondFactorEnabled() {
    return totpEnabledAt != null && totpSecretSealed != null;
  }

  /**
   * Not soft-deleted and not under a ban that is still running at {@code now}.
   *
   * @param now current time
   * @return whether the account may authenticate
   */
  public boolean isActive(Instant now) {
    if (deletedAt != null) {
      return false;
    }
    return bannedAt == null || (bannedUntil != null && !bannedUntil.isAfter(now));
  }

  /**
   * Name shown in authenticator apps.
   *
   * @return email, else username, else id
   */
  public String accountLabel() {
    if (email != null) {
      return email;
    }
    return username != null ? username : id;
  }

  public UserRecord withPasswordHash(String hash) {
    return new UserRecord(id, email, username, hash, walletAddress, totpSecretSealed,
        backupCodeHashes, totpEnabledAt, bannedAt, bannedUntil, deletedAt, tokensRevokedBefore,
        createdAt, version);
  }

  public UserRecord withSecondFactor(String sealedSecret, List<String> codeHashes, Instant enabledAt) {
    return new UserRecord(id, email, username, passwordHash, walletAddress, sealedSecret,
        codeHashes, enabledAt, bannedAt, bannedUntil, deletedAt, tokensRevokedBefore,
        createdAt, version);
  }

  public UserRecord withoutSecondFactor() {
    return withSecondFactor(null, List.of(), null);
  }

  public UserRecord withBackupCodeHashes(List<String> codeHashes) {
    return new UserRecord(id, email, username, passwordHash, walletAddress, totpSecretSealed,
        codeHashes, totpEnabledAt, bannedAt, bannedUntil, deletedAt, tokensRevokedBefore,
        createdAt, version);
  }

  public UserRecord withBan(Instant at, Instant until) {
    return new UserRecord(id, email, username, passwordHash, walletAddress, totpSecretSealed,
        backupCodeHashes, totpEnabledAt, at, until, deletedAt, tokensRevokedBefore,
        createdAt, version);
  }

  public UserRecord withDeletedAt(Instant at) {
    return new UserRecord(id, email, username, passwordHash, walletAddress, totpSecretSealed,
        backupCodeHashes, totpEnabledAt, bannedAt, bannedUntil, at, tokensRevokedBefore,
        createdAt, version);
  }

  /**
   * Kills every bearer token issued before {@code now}. Token issue times have one-second
   * resolution, so the cutoff is truncated to the second and never moves backwards.
   *
   * @param now revocation time
   * @return the updated copy
   */
  public UserRecord withTokensRevokedAt(Instant now) {
    Instant cutoff = now.truncatedTo(ChronoUnit.SECONDS);
    if (tokensRevokedBefore != null && tokensRevokedBefore.isAfter(cutoff)) {
      cutoff = tokensRevokedBefore;
    }
    return new UserRecord(id, email, username, passwordHash, walletAddress, totpSecretSealed,
        backupCodeHashes, totpEnabledAt, bannedAt, bannedUntil, deletedAt, cutoff, createdAt,
        version);
  }

  public boolean tokenRevoked(Instant issuedAt) {
    return tokensRevokedBefore != null && issuedAt.isBefore(tokensRevokedBefore);
  }

  UserRecord withVersion(long newVersion) {
    return new UserRecord(id, email, username, passwordHash, walletAddress, totpSecretSealed,
        backupCodeHashes, totpEnabledAt, bannedAt, bannedUntil, deletedAt, tokensRevokedBefore,
        createdAt, newVersion);
  }
}
