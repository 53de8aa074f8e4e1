package com.cgraph.auth.crypto.wallet;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;
import org.bouncycastle.util.BigIntegers;
import org.bouncycastle.util.encoders.Hex;

/**
 * A 65 byte {@code r || s || v} secp256k1 signature as produced by wallets.
 *
 * @param r          signature r component
 * @param s          signature s component
 * @param recoveryId recovery id in 0..3 (v already normalized)
 */
public record RecoverableSignature(BigInteger r, BigInteger s, int recoveryId) {

  private static final Pattern HEX_130 = Pattern.compile("[0-9a-fA-F]{130}");
  private static final int V_OFFSET = 27;

  /**
   * Parses the hex wire form. Accepts an optional {@code 0x} prefix and requires exactly 130 hex
   * characters. {@code v} values of 27 or more are shifted down to a recovery id.
   *
   * @param encoded the hex signature
   * @return the parsed signature, or empty if the format is wrong
   */
  public static Optional<RecoverableSignature> parse(String encoded) {
    if (encoded == null) {
      return Optional.empty();
    }
    String hex = encoded.startsWith("0x") || encoded.startsWith("0X") ? encoded.substring(2) : encoded;
    if (!HEX_130.matcher(hex).matches()) {
      return Optional.empty();
    }
    byte[] raw = Hex.decode(hex);
    BigInteger r = new BigInteger(1, Arrays.copyOfRange(raw, 0, 32));
    BigInteger s = new BigInteger(1, Arrays.copyOfRange(raw, 32, 64));
    int v = raw[64] & 0xFF;
    int recoveryId = v >= V_OFFSET ? v - V_OFFSET : v;
    if (recoveryId > 3) {
      return Optional.empty();
    }
    return Optional.of(new RecoverableSignature(r, s, recoveryId));
  }

  /**
   * Encodes as {@code 0x} + 130 lower-case hex characters with {@code v = recoveryId + 27}.
   *
   * @return the hex wire form
   */
  public String toHex() {
    byte[] raw = new byte[65];
    System.arraycopy(BigIntegers.asUnsignedByteArray(32, r), 0, raw, 0, 32);
    System.arraycopy(BigIntegers.asUnsignedByteArray(32, s), 0, raw, 32, 32);
    raw[64] = (byte) (recoveryId + V_OFFSET);
    return "0x" + Hex.toHexString(raw);
  }
}
