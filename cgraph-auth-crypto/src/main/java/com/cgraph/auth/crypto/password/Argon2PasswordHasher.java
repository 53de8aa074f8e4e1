package com.cgraph.auth.crypto.password;

import com.cgraph.auth.crypto.common.ByteUtils;
import com.cgraph.auth.crypto.common.CryptoException;
import com.cgraph.auth.crypto.common.RandomProvider;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Argon2id password hashing encoded as a PHC string:
 * {@code $argon2id$v=19$m=<kib>,t=<iterations>,p=<lanes>$<salt>$<hash>}.
 * <p>
 * Verification reads the cost parameters from the stored string, so hashes made under older
 * settings keep verifying after the settings change.
 */
public class Argon2PasswordHasher {

  private static final Logger log = LoggerFactory.getLogger(Argon2PasswordHasher.class);

  private static final int SALT_BYTES = 16;
  private static final int HASH_BYTES = 32;
  private static final Pattern PHC = Pattern.compile(
      "^\\$argon2id\\$v=19\\$m=(\\d+),t=(\\d+),p=(\\d+)\\$([A-Za-z0-9+/]+)\\$([A-Za-z0-9+/]+)$");
  private static final Base64.Encoder B64 = Base64.getEncoder().withoutPadding();
  private static final Base64.Decoder B64_DECODER = Base64.getDecoder();

  private final Argon2Settings settings;
  private final RandomProvider randomProvider;
  private final String referenceHash;

  /**
   * Creates a hasher and computes the reference hash used when there is no stored hash to check.
   *
   * @param settings       cost parameters for new hashes
   * @param randomProvider salt source
   */
  public Argon2PasswordHasher(Argon2Settings settings, RandomProvider randomProvider) {
    this.settings = settings;
    this.randomProvider = randomProvider;
    this.referenceHash = hash(Hex.toHexString(randomProvider.randomBytes(16)));
    log.info("Argon2id hasher ready (m={} KiB, t={}, p={})",
        settings.memoryKib(), settings.iterations(), settings.parallelism());
  }

  /**
   * Hashes a password with a fresh random salt.
   *
   * @param password the plaintext password
   * @return PHC-encoded hash
   */
  public String hash(String password) {
    byte[] salt = randomProvider.randomBytes(SALT_BYTES);
    byte[] derived = derive(password, salt, settings.memoryKib(), settings.iterations(),
        settings.parallelism());
    return "$argon2id$v=19$m=" + settings.memoryKib()
        + ",t=" + settings.iterations()
        + ",p=" + settings.parallelism()
        + "$" + B64.encodeToString(salt)
        + "$" + B64.encodeToString(derived);
  }

  /**
   * Checks a password against a stored hash in constant time.
   *
   * @param password     the plaintext candidate
   * @param encodedHash  stored PHC string
   * @return true on match
   * @throws CryptoException if the stored value is not an Argon2id PHC string
   */
  public boolean verify(String password, String encodedHash) {
    Matcher m = PHC.matcher(encodedHash == null ? "" : encodedHash);
    if (!m.matches()) {
      throw new CryptoException("Stored password hash is not an Argon2id PHC string");
    }
    int memory = Integer.parseInt(m.group(1));
    int iterations = Integer.parseInt(m.group(2));
    int parallelism = Integer.parseInt(m.group(3));
    byte[] salt = B64_DECODER.decode(m.group(4));
    byte[] expected = B64_DECODER.decode(m.group(5));
    byte[] actual = derive(password, salt, memory, iterations, parallelism, expected.length);
    return ByteUtils.constantTimeEquals(expected, actual);
  }

  /**
   * Runs a full verification against the reference hash and discards the result. Callers use this
   * when the account does not exist so both paths do the same work.
   *
   * @param password the submitted password
   */
  public void verifyAgainstReference(String password) {
    boolean ignored = verify(password, referenceHash);
    log.trace("Reference verification done ({})", ignored);
  }

  /**
   * Whether the reference hash still verifies against itself. Used by health checks.
   *
   * @return true if the primitive is functional
   */
  public boolean selfTest() {
    String sample = "self-test";
    return verify(sample, hash(sample));
  }

  private static byte[] derive(String password, byte[] salt, int memory, int iterations,
                               int parallelism) {
    return derive(password, salt, memory, iterations, parallelism, HASH_BYTES);
  }

  private static byte[] derive(String password, byte[] salt, int memory, int iterations,
                               int parallelism, int length) {
    Argon2BytesGenerator gen = new Argon2BytesGenerator();
    Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withSalt(salt)
        .withMemoryAsKB(memory)
        .withIterations(iterations)
        .withParallelism(parallelism)
        .build();
    gen.init(params);
    byte[] output = new byte[length];
    gen.generateBytes(password.getBytes(StandardCharsets.UTF_8), output, 0, output.length);
    return output;
  }
}
