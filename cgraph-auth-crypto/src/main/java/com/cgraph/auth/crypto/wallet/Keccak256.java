package com.cgraph.auth.crypto.wallet;

import org.bouncycastle.crypto.digests.KeccakDigest;

/**
 * Original Keccak-256 (pre-NIST padding), the hash Ethereum uses for addresses and message
 * digests. This is not SHA3-256.
 */
public final class Keccak256 {

  private Keccak256() {
  }

  /**
   * Hashes the input.
   *
   * @param input bytes to hash
   * @return 32 byte digest
   */
  public static byte[] hash(byte[] input) {
    KeccakDigest digest = new KeccakDigest(256);
    digest.update(input, 0, input.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }
}
