package com.cgraph.auth.crypto.wallet;

import com.cgraph.auth.crypto.common.ByteUtils;
import java.nio.charset.StandardCharsets;

/**
 * The "personal sign" convention used by browser wallets: the message is prefixed with
 * {@code "\x19Ethereum Signed Message:\n"} and its decimal byte length before hashing, so a signed
 * login message can never be replayed as a transaction.
 */
public final class PersonalMessage {

  static final String PREFIX = "\u0019Ethereum Signed Message:\n";

  private PersonalMessage() {
  }

  /**
   * Computes Keccak-256(prefix + len(message) + message).
   *
   * @param message the exact text the wallet displayed and signed
   * @return 32 byte digest
   */
  public static byte[] digest(String message) {
    byte[] body = message.getBytes(StandardCharsets.UTF_8);
    byte[] header = (PREFIX + body.length).getBytes(StandardCharsets.UTF_8);
    return Keccak256.hash(ByteUtils.concat(header, body));
  }
}
