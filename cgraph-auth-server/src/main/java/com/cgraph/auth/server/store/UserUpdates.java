package com.cgraph.auth.server.store;

import java.util.Optional;
import java.util.function.Function;

/**
 * Optimistic read-modify-write over {@link UserStore#compareAndSet}. The step function sees the
 * latest record on every attempt and either returns the replacement or a terminal outcome.
 */
public final class UserUpdates {

  static final int MAX_ATTEMPTS = 8;

  private UserUpdates() {
  }

  /**
   * Outcome of one attempt: a replacement to write, or a result to return without writing.
   *
   * @param <T> result type
   */
  public record Step<T>(UserRecord replacement, T result) {

    public static <T> Step<T> write(UserRecord replacement, T result) {
      return new Step<>(replacement, result);
    }

    public static <T> Step<T> stop(T result) {
      return new Step<>(null, result);
    }
  }

  /**
   * Applies {@code step} until its write lands or it stops.
   *
   * @param store  user store
   * @param userId user to change
   * @param step   computes the change from the current record
   * @param <T>    result type
   * @return the step's result
   * @throws StoreException if the user does not exist or contention never clears
   */
  public static <T> T apply(UserStore store, String userId, Function<UserRecord, Step<T>> step) {
    for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
      UserRecord current = store.findById(userId)
          .orElseThrow(() -> new StoreException("User not found: " + userId));
      Step<T> next = step.apply(current);
      if (next.replacement() == null) {
        return next.result();
      }
      Optional<UserRecord> written = store.compareAndSet(current, next.replacement());
      if (written.isPresent()) {
        return next.result();
      }
    }
    throw new StoreException("Too much contention updating user " + userId);
  }
}
