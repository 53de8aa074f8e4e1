package com.cgraph.auth.server.store;

import java.time.Instant;

/**
 * The live single-use challenge for one wallet address.
 *
 * @param address  lower-case {@code 0x} address
 * @param nonce    64 hex characters
 * @param issuedAt when this nonce was generated
 */
public record WalletChallenge(String address, String nonce, Instant issuedAt) {

  public boolean isStale(Instant staleBefore) {
    return issuedAt.isBefore(staleBefore);
  }
}
