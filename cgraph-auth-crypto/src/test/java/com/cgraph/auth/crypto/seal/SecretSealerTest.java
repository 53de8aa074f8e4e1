package com.cgraph.auth.crypto.seal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cgraph.auth.crypto.common.CryptoException;
import com.cgraph.auth.crypto.common.RandomProvider;
import java.util.Base64;
import org.junit.jupiter.api.Test;

class SecretSealerTest {

  private final RandomProvider random = new RandomProvider();
  private final SecretSealer sealer = new SecretSealer("key-one".getBytes(), random);

  @Test
  void sealThenOpen_returnsSecret() {
    byte[] secret = random.randomBytes(20);
    assertThat(sealer.open(sealer.seal(secret))).isEqualTo(secret);
  }

  @Test
  void seal_usesFreshIv() {
    byte[] secret = random.randomBytes(20);
    assertThat(sealer.seal(secret)).isNotEqualTo(sealer.seal(secret));
  }

  @Test
  void open_underOtherKey_isAFault() {
    String sealed = sealer.seal(random.randomBytes(20));
    SecretSealer other = new SecretSealer("key-two".getBytes(), random);
    assertThatThrownBy(() -> other.open(sealed)).isInstanceOf(CryptoException.class);
  }

  @Test
  void open_tampered_isAFault() {
    byte[] raw = Base64.getDecoder().decode(sealer.seal(random.randomBytes(20)));
    raw[raw.length - 1] ^= 0x01;
    String tampered = Base64.getEncoder().encodeToString(raw);
    assertThatThrownBy(() -> sealer.open(tampered)).isInstanceOf(CryptoException.class);
  }

  @Test
  void open_garbage_isAFault() {
    assertThatThrownBy(() -> sealer.open("not base64!")).isInstanceOf(CryptoException.class);
    assertThatThrownBy(() -> sealer.open("AAAA")).isInstanceOf(CryptoException.class);
  }
}
