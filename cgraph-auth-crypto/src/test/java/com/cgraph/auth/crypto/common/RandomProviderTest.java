package com.cgraph.auth.crypto.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.security.SecureRandom;
import org.junit.jupiter.api.Test;

class RandomProviderTest {

  @Test
  void customRandom_isPreserved() {
    SecureRandom custom = new SecureRandom();
    assertThat(new RandomProvider(custom).random()).isSameAs(custom);
  }

  @Test
  void randomBytes_returnsRequestedLengthAndVaries() {
    RandomProvider rp = new RandomProvider();
    assertThat(rp.randomBytes(0)).isEmpty();
    byte[] a = rp.randomBytes(32);
    byte[] b = rp.randomBytes(32);
    assertThat(a).hasSize(32);
    assertThat(a).isNotEqualTo(b);
  }
}
