package com.cgraph.auth.server.manager;

import static org.assertj.core.api.Assertions.assertThat;

import com.cgraph.auth.crypto.wallet.PersonalMessage;
import com.cgraph.auth.crypto.wallet.Secp256k1;
import com.cgraph.auth.server.AuthFixture;
import com.cgraph.auth.server.result.AuthError;
import com.cgraph.auth.server.result.AuthResult;
import com.cgraph.auth.server.store.UserRecord;
import com.cgraph.auth.server.store.WalletChallenge;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WalletChallengeAuthenticatorTest {

  private static final BigInteger KEY = BigInteger.ONE;
  private static final String ADDRESS = "0x7e5f4552091a69125d5dfcb7b8c2659029395bdf";
  private static final BigInteger OTHER_KEY = new BigInteger(
      "4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318", 16);

  private AuthFixture fixture;
  private WalletChallengeAuthenticator wallet;

  @BeforeEach
  void setUp() {
    fixture = new AuthFixture();
    wallet = fixture.walletAuthenticator;
  }

  private String sign(String nonce, BigInteger key) {
    return Secp256k1.sign(PersonalMessage.digest(wallet.challengeMessage(nonce)), key).toHex();
  }

  @Test
  void challengeMessage_hasFixedShape() {
    assertThat(wallet.challengeMessage("abc"))
        .isEqualTo("Sign this message to authenticate with CGraph.\n\nNonce: abc");
  }

  @Test
  void verify_validSignature_provisionsUserOnce() {
    WalletChallenge challenge = wallet.issueChallenge(ADDRESS).get();

    AuthResult<UserRecord> first = wallet.verify(ADDRESS, sign(challenge.nonce(), KEY));

    assertThat(first.isSuccess()).isTrue();
    assertThat(first.get().walletAddress()).isEqualTo(ADDRESS);
    assertThat(first.get().username()).isEqualTo("wallet_7e5f4552");

    WalletChallenge next = wallet.issueChallenge(ADDRESS).get();
    assertThat(next.nonce()).isNotEqualTo(challenge.nonce());
    AuthResult<UserRecord> second = wallet.verify(ADDRESS, sign(next.nonce(), KEY));
    assertThat(second.get().id()).isEqualTo(first.get().id());
  }

  @Test
  void verify_replayedSignature_isChallengeNotFound() {
    WalletChallenge challenge = wallet.issueChallenge(ADDRESS).get();
    String signature = sign(challenge.nonce(), KEY);

    assertThat(wallet.verify(ADDRESS, signature).isSuccess()).isTrue();
    assertThat(wallet.verify(ADDRESS, signature).getError()).isEqualTo(AuthError.CHALLENGE_NOT_FOUND);
  }

  @Test
  void verify_concurrentReplay_onlyOneSucceeds() throws Exception {
    WalletChallenge challenge = wallet.issueChallenge(ADDRESS).get();
    String signature = sign(challenge.nonce(), KEY);
    int threads = 6;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<AuthResult<UserRecord>>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        Callable<AuthResult<UserRecord>> task = () -> {
          start.await();
          return wallet.verify(ADDRESS, signature);
        };
        futures.add(pool.submit(task));
      }
      start.countDown();
      int successes = 0;
      for (Future<AuthResult<UserRecord>> future : futures) {
        AuthResult<UserRecord> result = future.get();
        if (result.isSuccess()) {
          successes++;
        } else {
          assertThat(result.getError()).isEqualTo(AuthError.CHALLENGE_NOT_FOUND);
        }
      }
      assertThat(successes).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void issueChallenge_stableWithinWindow_rotatedAfter() {
    String first = wallet.issueChallenge(ADDRESS).get().nonce();
    fixture.clock.advance(Duration.ofSeconds(120));
    assertThat(wallet.issueChallenge(ADDRESS).get().nonce()).isEqualTo(first);

    fixture.clock.advance(Duration.ofSeconds(181));
    String rotated = wallet.issueChallenge(ADDRESS).get().nonce();
    assertThat(rotated).isNotEqualTo(first).hasSize(64).matches("[0-9a-f]+");
  }

  @Test
  void issueChallenge_normalizesCaseAndRejectsMalformed() {
    String upper = "0x" + ADDRESS.substring(2).toUpperCase(Locale.ROOT);
    assertThat(wallet.issueChallenge(upper).get().address()).isEqualTo(ADDRESS);

    assertThat(wallet.issueChallenge("0x1234").getError()).isEqualTo(AuthError.INVALID_REQUEST);
    assertThat(wallet.issueChallenge(ADDRESS.substring(2)).getError()).isEqualTo(AuthError.INVALID_REQUEST);
    assertThat(wallet.issueChallenge(null).getError()).isEqualTo(AuthError.INVALID_REQUEST);
  }

  @Test
  void verify_afterTtl_isExpired() {
    WalletChallenge challenge = wallet.issueChallenge(ADDRESS).get();
    fixture.clock.advance(Duration.ofSeconds(301));

    assertThat(wallet.verify(ADDRESS, sign(challenge.nonce(), KEY)).getError())
        .isEqualTo(AuthError.CHALLENGE_EXPIRED);
  }

  @Test
  void verify_withoutChallenge_isNotFound() {
    assertThat(wallet.verify(ADDRESS, sign("deadbeef", KEY)).getError())
        .isEqualTo(AuthError.CHALLENGE_NOT_FOUND);
  }

  @Test
  void verify_wrongSignerOrGarbage_isInvalidSignatureAndKeepsChallenge() {
    WalletChallenge challenge = wallet.issueChallenge(ADDRESS).get();

    assertThat(wallet.verify(ADDRESS, sign(challenge.nonce(), OTHER_KEY)).getError())
        .isEqualTo(AuthError.INVALID_SIGNATURE);
    assertThat(wallet.verify(ADDRESS, sign("other-nonce", KEY)).getError())
        .isEqualTo(AuthError.INVALID_SIGNATURE);
    assertThat(wallet.verify(ADDRESS, "0x1234").getError()).isEqualTo(AuthError.INVALID_SIGNATURE);
    assertThat(wallet.verify(ADDRESS, null).getError()).isEqualTo(AuthError.INVALID_SIGNATURE);

    assertThat(wallet.verify(ADDRESS, sign(challenge.nonce(), KEY)).isSuccess()).isTrue();
  }

  @Test
  void verify_shortUsernameTaken_fallsBackToFullAddress() {
    fixture.userStore.insert(UserRecord.withPassword("someone", "s@example.com", "wallet_7e5f4552",
        "h", fixture.clock.instant()));
    WalletChallenge challenge = wallet.issueChallenge(ADDRESS).get();

    UserRecord user = wallet.verify(ADDRESS, sign(challenge.nonce(), KEY)).get();

    assertThat(user.username()).isEqualTo("wallet_" + ADDRESS.substring(2));
  }
}
