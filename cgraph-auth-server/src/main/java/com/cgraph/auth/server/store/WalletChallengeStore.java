package com.cgraph.auth.server.store;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for wallet challenges, at most one per address.
 * <p>
 * Implementations must be thread-safe, and both mutating operations must be atomic.
 */
public interface WalletChallengeStore {

  /**
   * Returns the live challenge for the address, first replacing it with {@code candidate} if none
   * exists or the existing one was issued before {@code staleBefore}.
   *
   * @param candidate   challenge to store when a new one is needed
   * @param staleBefore issue time below which the existing challenge is rotated
   * @return the challenge now stored
   */
  WalletChallenge getOrRotate(WalletChallenge candidate, Instant staleBefore);

  Optional<WalletChallenge> find(String address);

  /**
   * Deletes the challenge only if it is still exactly {@code challenge}. Of several callers
   * presenting the same challenge, exactly one sees {@code true}.
   *
   * @param challenge the challenge that was verified
   * @return true if this call removed it
   */
  boolean consume(WalletChallenge challenge);
}
