package com.cgraph.auth.crypto.wallet;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class RecoverableSignatureTest {

  private static final String R = "11".repeat(32);
  private static final String S = "22".repeat(32);

  @Test
  void parse_withPrefixAndLegacyV() {
    RecoverableSignature sig = RecoverableSignature.parse("0x" + R + S + "1c").orElseThrow();
    assertThat(sig.r()).isEqualTo(new BigInteger(R, 16));
    assertThat(sig.s()).isEqualTo(new BigInteger(S, 16));
    assertThat(sig.recoveryId()).isEqualTo(1);
  }

  @Test
  void parse_withoutPrefixAndRawRecoveryId() {
    assertThat(RecoverableSignature.parse(R + S + "00").orElseThrow().recoveryId()).isZero();
    assertThat(RecoverableSignature.parse(R + S + "1b").orElseThrow().recoveryId()).isZero();
  }

  @Test
  void parse_upperCaseHex() {
    assertThat(RecoverableSignature.parse("0x" + (R + S).toUpperCase() + "1B")).isPresent();
  }

  @Test
  void parse_rejectsWrongLength() {
    assertThat(RecoverableSignature.parse("0x" + R + S)).isEmpty();
    assertThat(RecoverableSignature.parse("0x" + R + S + "1b00")).isEmpty();
    assertThat(RecoverableSignature.parse("")).isEmpty();
    assertThat(RecoverableSignature.parse(null)).isEmpty();
  }

  @Test
  void parse_rejectsNonHex() {
    assertThat(RecoverableSignature.parse("0x" + R + S.replace('2', 'g') + "1b")).isEmpty();
  }

  @Test
  void parse_rejectsRecoveryIdOutOfRange() {
    assertThat(RecoverableSignature.parse(R + S + "1f")).isEmpty();
    assertThat(RecoverableSignature.parse(R + S + "04")).isEmpty();
  }

  @Test
  void toHex_roundTripsParse() {
    String hex = "0x" + R + S + "1c";
    assertThat(RecoverableSignature.parse(hex).orElseThrow().toHex()).isEqualTo(hex);
  }
}
