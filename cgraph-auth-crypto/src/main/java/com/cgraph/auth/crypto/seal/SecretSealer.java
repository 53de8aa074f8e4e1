package com.cgraph.auth.crypto.seal;

import com.cgraph.auth.crypto.common.ByteUtils;
import com.cgraph.auth.crypto.common.CryptoException;
import com.cgraph.auth.crypto.common.RandomProvider;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM sealing of small secrets kept at rest, such as second-factor seeds. The sealed form
 * is Base64({@code iv || ciphertext || tag}).
 */
public class SecretSealer {

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final String KEY_LABEL = "totp_encryption:";
  private static final int IV_BYTES = 12;
  private static final int TAG_BITS = 128;

  private final SecretKeySpec key;
  private final RandomProvider randomProvider;

  /**
   * Derives the AES key as SHA-256 over a label and the configured key material.
   *
   * @param keyMaterial    configured key bytes
   * @param randomProvider IV source
   */
  public SecretSealer(byte[] keyMaterial, RandomProvider randomProvider) {
    byte[] label = KEY_LABEL.getBytes(StandardCharsets.UTF_8);
    this.key = new SecretKeySpec(ByteUtils.sha256(ByteUtils.concat(label, keyMaterial)), "AES");
    this.randomProvider = randomProvider;
  }

  /**
   * Encrypts a secret.
   *
   * @param plaintext the secret
   * @return sealed Base64 text
   */
  public String seal(byte[] plaintext) {
    byte[] iv = randomProvider.randomBytes(IV_BYTES);
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
      return Base64.getEncoder().encodeToString(ByteUtils.concat(iv, cipher.doFinal(plaintext)));
    } catch (GeneralSecurityException e) {
      throw new CryptoException("Unable to seal secret", e);
    }
  }

  /**
   * Decrypts a sealed secret.
   *
   * @param sealed Base64 text from {@link #seal(byte[])}
   * @return the secret
   * @throws CryptoException if the value was tampered with or sealed under another key
   */
  public byte[] open(String sealed) {
    byte[] raw;
    try {
      raw = Base64.getDecoder().decode(sealed);
    } catch (IllegalArgumentException e) {
      throw new CryptoException("Sealed secret is not valid Base64", e);
    }
    if (raw.length <= IV_BYTES) {
      throw new CryptoException("Sealed secret is truncated");
    }
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, key,
          new GCMParameterSpec(TAG_BITS, Arrays.copyOfRange(raw, 0, IV_BYTES)));
      return cipher.doFinal(raw, IV_BYTES, raw.length - IV_BYTES);
    } catch (GeneralSecurityException e) {
      throw new CryptoException("Unable to open sealed secret", e);
    }
  }
}
