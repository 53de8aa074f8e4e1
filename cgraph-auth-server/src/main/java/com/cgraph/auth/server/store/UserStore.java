package com.cgraph.auth.server.store;

import java.util.Optional;

/**
 * Storage abstraction for user records (the credential store).
 * <p>
 * Implementations must be thread-safe. Email, wallet address and username are unique when
 * present and never change after insert.
 */
public interface UserStore {

  /**
   * Inserts a new user.
   *
   * @param user the record, version 0
   * @return false if the email, wallet address or username is already taken
   */
  boolean insert(UserRecord user);

  Optional<UserRecord> findById(String id);

  /**
   * @param email lower-case email
   * @return the user, or empty
   */
  Optional<UserRecord> findByEmail(String email);

  /**
   * @param address lower-case {@code 0x} address
   * @return the user, or empty
   */
  Optional<UserRecord> findByWalletAddress(String address);

  /**
   * Replaces {@code current} with {@code replacement} only if the stored version still equals
   * {@code current.version()}. The stored copy gets the next version number.
   *
   * @param current     the record the change was computed from
   * @param replacement the new state
   * @return the stored record, or empty if another writer got there first
   */
  Optional<UserRecord> compareAndSet(UserRecord current, UserRecord replacement);
}
