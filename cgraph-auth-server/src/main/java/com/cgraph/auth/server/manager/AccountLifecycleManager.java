package com.cgraph.auth.server.manager;

import com.cgraph.auth.server.result.AuthError;
import com.cgraph.auth.server.result.AuthResult;
import com.cgraph.auth.server.store.UserRecord;
import com.cgraph.auth.server.store.UserStore;
import com.cgraph.auth.server.store.UserUpdates;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Administrative account state: ban, unban and soft delete. Banning and deleting revoke every
 * session immediately; access tokens stop being accepted on their next use.
 */
@Singleton
public class AccountLifecycleManager {

  private static final Logger log = LoggerFactory.getLogger(AccountLifecycleManager.class);

  private final UserStore userStore;
  private final SessionRegistry sessionRegistry;
  private final Clock clock;

  @Inject
  public AccountLifecycleManager(UserStore userStore, SessionRegistry sessionRegistry, Clock clock) {
    this.userStore = userStore;
    this.sessionRegistry = sessionRegistry;
    this.clock = clock;
  }

  /**
   * Bans a user and revokes all their sessions and tokens.
   *
   * @param userId the user
   * @param until  end of the ban, null for permanent
   * @return the updated user, or {@code invalid_request} for an unknown id
   */
  public AuthResult<UserRecord> ban(String userId, Instant until) {
    if (userStore.findById(userId).isEmpty()) {
      return AuthResult.failure(AuthError.INVALID_REQUEST);
    }
    Instant now = clock.instant();
    UserRecord banned = UserUpdates.apply(userStore, userId, user -> {
      UserRecord updated = user.withBan(now, until).withTokensRevokedAt(now);
      return UserUpdates.Step.write(updated, updated);
    });
    log.info("Banned user={} until={}", userId, until == null ? "permanent" : until);
    sessionRegistry.revokeAll(userId);
    return AuthResult.success(banned);
  }

  /**
   * Lifts a ban.
   *
   * @param userId the user
   * @return the updated user, or {@code invalid_request} for an unknown id
   */
  public AuthResult<UserRecord> unban(String userId) {
    if (userStore.findById(userId).isEmpty()) {
      return AuthResult.failure(AuthError.INVALID_REQUEST);
    }
    UserRecord unbanned = UserUpdates.apply(userStore, userId, user -> {
      UserRecord updated = user.withBan(null, null);
      return UserUpdates.Step.write(updated, updated);
    });
    log.info("Unbanned user={}", userId);
    return AuthResult.success(unbanned);
  }

  /**
   * Soft-deletes a user and revokes all their sessions and tokens. The record is kept.
   *
   * @param userId the user
   * @return the updated user, or {@code invalid_request} for an unknown id
   */
  public AuthResult<UserRecord> deactivate(String userId) {
    if (userStore.findById(userId).isEmpty()) {
      return AuthResult.failure(AuthError.INVALID_REQUEST);
    }
    Instant now = clock.instant();
    UserRecord deleted = UserUpdates.apply(userStore, userId, user -> {
      UserRecord updated = user.withDeletedAt(now).withTokensRevokedAt(now);
      return UserUpdates.Step.write(updated, updated);
    });
    log.info("Deactivated user={}", userId);
    sessionRegistry.revokeAll(userId);
    return AuthResult.success(deleted);
  }
}
