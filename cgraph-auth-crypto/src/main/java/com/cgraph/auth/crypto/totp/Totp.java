package com.cgraph.auth.crypto.totp;

import com.cgraph.auth.crypto.common.ByteUtils;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Locale;
import org.bouncycastle.crypto.digests.SHA1Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.encoders.Base32;

/**
 * Time-based one-time codes (RFC 6238) over HMAC-SHA1 HOTP (RFC 4226).
 */
public class Totp {

  public static final int DEFAULT_DIGITS = 6;
  public static final int DEFAULT_PERIOD_SECONDS = 30;
  public static final int DEFAULT_WINDOW = 1;
  public static final int SECRET_BYTES = 20;

  private static final int[] POWERS = {1, 10, 100, 1_000, 10_000, 100_000, 1_000_000, 10_000_000,
      100_000_000};

  private final int digits;
  private final int periodSeconds;
  private final int window;

  /**
   * Creates a generator.
   *
   * @param digits        code length, 6 to 8
   * @param periodSeconds time step
   * @param window        accepted steps either side of the current one
   */
  public Totp(int digits, int periodSeconds, int window) {
    if (digits < 6 || digits > 8) {
      throw new IllegalArgumentException("digits must be between 6 and 8");
    }
    if (periodSeconds <= 0 || window < 0) {
      throw new IllegalArgumentException("period must be positive and window non-negative");
    }
    this.digits = digits;
    this.periodSeconds = periodSeconds;
    this.window = window;
  }

  /**
   * The authenticator-app profile: six digits, 30 second step, one step of drift either way.
   *
   * @return the standard generator
   */
  public static Totp standard() {
    return new Totp(DEFAULT_DIGITS, DEFAULT_PERIOD_SECONDS, DEFAULT_WINDOW);
  }

  /**
   * HOTP value for a counter.
   *
   * @param secret  shared secret
   * @param counter moving factor
   * @return zero-padded code
   */
  public String hotp(byte[] secret, long counter) {
    HMac mac = new HMac(new SHA1Digest());
    mac.init(new KeyParameter(secret));
    byte[] message = ByteUtils.longToBytes(counter);
    mac.update(message, 0, message.length);
    byte[] hash = new byte[mac.getMacSize()];
    mac.doFinal(hash, 0);

    int offset = hash[hash.length - 1] & 0x0F;
    int binary = ((hash[offset] & 0x7F) << 24)
        | ((hash[offset + 1] & 0xFF) << 16)
        | ((hash[offset + 2] & 0xFF) << 8)
        | (hash[offset + 3] & 0xFF);
    int otp = binary % POWERS[digits];
    StringBuilder code = new StringBuilder(Integer.toString(otp));
    while (code.length() < digits) {
      code.insert(0, '0');
    }
    return code.toString();
  }

  /**
   * Code for the time step containing {@code at}.
   *
   * @param secret shared secret
   * @param at     instant
   * @return the code
   */
  public String codeAt(byte[] secret, Instant at) {
    return hotp(secret, timeStep(at));
  }

  /**
   * Checks a submitted code against the current step and {@code window} steps either side.
   * Every candidate step is computed and compared in constant time.
   *
   * @param secret shared secret
   * @param code   submitted code, surrounding whitespace ignored
   * @param now    current time
   * @return true if the code matches one of the accepted steps
   */
  public boolean verify(byte[] secret, String code, Instant now) {
    if (code == null) {
      return false;
    }
    String candidate = code.strip();
    if (candidate.length() != digits || !candidate.chars().allMatch(Character::isDigit)) {
      return false;
    }
    long current = timeStep(now);
    boolean matched = false;
    for (long step = current - window; step <= current + window; step++) {
      if (step >= 0) {
        matched |= ByteUtils.constantTimeEquals(hotp(secret, step), candidate);
      }
    }
    return matched;
  }

  /**
   * Builds the {@code otpauth://} URI that authenticator apps read from a QR code.
   *
   * @param issuer  service name shown in the app
   * @param account account label, usually the email
   * @param secret  shared secret
   * @return the provisioning URI
   */
  public String provisioningUri(String issuer, String account, byte[] secret) {
    String label = encode(issuer) + ":" + encode(account);
    return "otpauth://totp/" + label
        + "?secret=" + encodeSecret(secret)
        + "&issuer=" + encode(issuer)
        + "&algorithm=SHA1"
        + "&digits=" + digits
        + "&period=" + periodSeconds;
  }

  /**
   * Base32 form of a secret without padding, as authenticator apps expect.
   *
   * @param secret raw secret
   * @return upper-case base32
   */
  public static String encodeSecret(byte[] secret) {
    return Base32.toBase32String(secret).replace("=", "");
  }

  /**
   * Decodes a Base32 secret, case-insensitive, padding optional.
   *
   * @param encoded base32 text
   * @return raw secret
   */
  public static byte[] decodeSecret(String encoded) {
    String upper = encoded.strip().toUpperCase(Locale.ROOT).replace("=", "");
    StringBuilder padded = new StringBuilder(upper);
    while (padded.length() % 8 != 0) {
      padded.append('=');
    }
    return Base32.decode(padded.toString());
  }

  public int digits() {
    return digits;
  }

  public int periodSeconds() {
    return periodSeconds;
  }

  private long timeStep(Instant at) {
    return Math.floorDiv(at.getEpochSecond(), periodSeconds);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
