package com.cgraph.auth.crypto.common;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.Arrays;

/**
 * Byte-level helpers shared by the primitives.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the concatenation
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Big-endian eight byte encoding of a long, as used for HOTP counters.
   *
   * @param value the value
   * @return eight bytes
   */
  public static byte[] longToBytes(long value) {
    byte[] result = new byte[8];
    for (int i = 7; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>>= 8;
    }
    return result;
  }

  /**
   * Returns the last {@code length} bytes of the input.
   *
   * @param input  the input
   * @param length how many trailing bytes to keep
   * @return the suffix
   */
  public static byte[] tail(byte[] input, int length) {
    return Arrays.copyOfRange(input, input.length - length, input.length);
  }

  /**
   * SHA-256 of the input.
   *
   * @param input the input
   * @return 32 byte digest
   */
  public static byte[] sha256(byte[] input) {
    SHA256Digest digest = new SHA256Digest();
    digest.update(input, 0, input.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }

  /**
   * Standard Base64 of SHA-256 over the UTF-8 bytes of a string. Used wherever a secret is stored
   * only as a lookup hash (session tokens, backup codes).
   *
   * @param value the value
   * @return base64 digest
   */
  public static String sha256Base64(String value) {
    return Base64.getEncoder().encodeToString(sha256(value.getBytes(StandardCharsets.UTF_8)));
  }

  /**
   * Constant-time comparison.
   *
   * @param a first
   * @param b second
   * @return true if equal
   */
  public static boolean constantTimeEquals(byte[] a, byte[] b) {
    return Arrays.constantTimeAreEqual(a, b);
  }

  /**
   * Constant-time comparison of two strings over their UTF-8 bytes.
   *
   * @param a first
   * @param b second
   * @return true if equal
   */
  public static boolean constantTimeEquals(String a, String b) {
    return Arrays.constantTimeAreEqual(a.getBytes(StandardCharsets.UTF_8),
        b.getBytes(StandardCharsets.UTF_8));
  }
}
