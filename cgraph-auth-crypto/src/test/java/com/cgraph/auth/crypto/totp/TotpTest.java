package com.cgraph.auth.crypto.totp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TotpTest {

  // RFC 6238 appendix B, SHA1 seed
  private static final byte[] RFC_SECRET = "12345678901234567890".getBytes(StandardCharsets.US_ASCII);

  @ParameterizedTest
  @CsvSource({
      "59, 94287082",
      "1111111109, 07081804",
      "1111111111, 14050471",
      "1234567890, 89005924",
      "2000000000, 69279037",
      "20000000000, 65353130"
  })
  void codeAt_matchesRfc6238EightDigitVectors(long epochSeconds, String expected) {
    Totp totp = new Totp(8, 30, 1);
    assertThat(totp.codeAt(RFC_SECRET, Instant.ofEpochSecond(epochSeconds))).isEqualTo(expected);
  }

  @Test
  void codeAt_sixDigitsKeepsLeadingZeros() {
    Totp totp = Totp.standard();
    assertThat(totp.codeAt(RFC_SECRET, Instant.ofEpochSecond(59))).isEqualTo("287082");
    assertThat(totp.codeAt(RFC_SECRET, Instant.ofEpochSecond(1111111109))).isEqualTo("081804");
    assertThat(totp.codeAt(RFC_SECRET, Instant.ofEpochSecond(1234567890))).isEqualTo("005924");
  }

  @Test
  void verify_acceptsOneStepEitherSide() {
    Totp totp = Totp.standard();
    Instant now = Instant.ofEpochSecond(1_700_000_010L);
    String previous = totp.codeAt(RFC_SECRET, now.minusSeconds(30));
    String current = totp.codeAt(RFC_SECRET, now);
    String next = totp.codeAt(RFC_SECRET, now.plusSeconds(30));

    assertThat(totp.verify(RFC_SECRET, previous, now)).isTrue();
    assertThat(totp.verify(RFC_SECRET, current, now)).isTrue();
    assertThat(totp.verify(RFC_SECRET, next, now)).isTrue();
  }

  @Test
  void verify_rejectsTwoStepsAway() {
    Totp totp = Totp.standard();
    Instant now = Instant.ofEpochSecond(1_700_000_010L);
    String old = totp.codeAt(RFC_SECRET, now.minusSeconds(60));
    String future = totp.codeAt(RFC_SECRET, now.plusSeconds(60));

    assertThat(totp.verify(RFC_SECRET, old, now)).isFalse();
    assertThat(totp.verify(RFC_SECRET, future, now)).isFalse();
  }

  @Test
  void verify_rejectsMalformedInput() {
    Totp totp = Totp.standard();
    Instant now = Instant.ofEpochSecond(59);
    assertThat(totp.verify(RFC_SECRET, null, now)).isFalse();
    assertThat(totp.verify(RFC_SECRET, "28708", now)).isFalse();
    assertThat(totp.verify(RFC_SECRET, "2870820", now)).isFalse();
    assertThat(totp.verify(RFC_SECRET, "28708a", now)).isFalse();
    assertThat(totp.verify(RFC_SECRET, " 287082 ", now)).isTrue();
  }

  @Test
  void verify_wrongSecret_fails() {
    Totp totp = Totp.standard();
    Instant now = Instant.ofEpochSecond(59);
    byte[] other = "09876543210987654321".getBytes(StandardCharsets.US_ASCII);
    assertThat(totp.verify(other, "287082", now)).isFalse();
  }

  @Test
  void secretEncoding_roundTripsWithoutPadding() {
    String encoded = Totp.encodeSecret(RFC_SECRET);
    assertThat(encoded).isEqualTo("GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ");
    assertThat(Totp.decodeSecret(encoded.toLowerCase())).isEqualTo(RFC_SECRET);
  }

  @Test
  void provisioningUri_containsIssuerAndParameters() {
    String uri = Totp.standard().provisioningUri("CGraph", "ada@example.com", RFC_SECRET);
    assertThat(uri).isEqualTo("otpauth://totp/CGraph:ada%40example.com"
        + "?secret=GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ&issuer=CGraph&algorithm=SHA1&digits=6&period=30");
  }

  @Test
  void constructor_rejectsBadDigits() {
    assertThatThrownBy(() -> new Totp(5, 30, 1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Totp(9, 30, 1)).isInstanceOf(IllegalArgumentException.class);
  }
}
