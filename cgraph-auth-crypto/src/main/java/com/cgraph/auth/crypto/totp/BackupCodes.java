package com.cgraph.auth.crypto.totp;

import com.cgraph.auth.crypto.common.ByteUtils;
import com.cgraph.auth.crypto.common.RandomProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.bouncycastle.util.encoders.Base32;

/**
 * Single-use recovery codes shown as {@code XXXX-XXXX}. Each code is five random bytes rendered
 * as eight Base32 characters. Only {@link #hash(String)} of the canonical form is ever stored.
 */
public class BackupCodes {

  private static final int CODE_BYTES = 5;
  private static final Pattern CANONICAL_BODY = Pattern.compile("[A-Z2-7]{8}");
  private static final Pattern IGNORED = Pattern.compile("[\\s-]");

  private final RandomProvider randomProvider;

  public BackupCodes(RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  /**
   * Generates a fresh set of display-form codes.
   *
   * @param count how many
   * @return codes in {@code XXXX-XXXX} form
   */
  public List<String> generate(int count) {
    List<String> codes = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      String body = Base32.toBase32String(randomProvider.randomBytes(CODE_BYTES));
      codes.add(body.substring(0, 4) + "-" + body.substring(4));
    }
    return codes;
  }

  /**
   * Brings user input to the canonical {@code XXXX-XXXX} shape: upper-cases it, drops whitespace
   * and dashes, then re-inserts the dash.
   *
   * @param input what the user typed
   * @return the canonical code, or empty if the input cannot be a backup code
   */
  public static Optional<String> normalize(String input) {
    if (input == null) {
      return Optional.empty();
    }
    String body = IGNORED.matcher(input.toUpperCase(Locale.ROOT)).replaceAll("");
    if (!CANONICAL_BODY.matcher(body).matches()) {
      return Optional.empty();
    }
    return Optional.of(body.substring(0, 4) + "-" + body.substring(4));
  }

  /**
   * Storage hash of a canonical code.
   *
   * @param canonicalCode code in {@code XXXX-XXXX} form
   * @return base64 SHA-256
   */
  public static String hash(String canonicalCode) {
    return ByteUtils.sha256Base64(canonicalCode);
  }

  /**
   * Hashes every code in a freshly generated set.
   *
   * @param codes display-form codes
   * @return storage hashes, same order
   */
  public static List<String> hashAll(List<String> codes) {
    List<String> hashes = new ArrayList<>(codes.size());
    for (String code : codes) {
      hashes.add(hash(normalize(code).orElseThrow(
          () -> new IllegalArgumentException("Not a backup code"))));
    }
    return hashes;
  }
}
