package com.cgraph.auth.server.manager;

import com.cgraph.auth.crypto.common.RandomProvider;
import com.cgraph.auth.crypto.wallet.PersonalMessage;
import com.cgraph.auth.crypto.wallet.RecoverableSignature;
import com.cgraph.auth.crypto.wallet.Secp256k1;
import com.cgraph.auth.server.result.AuthError;
import com.cgraph.auth.server.result.AuthResult;
import com.cgraph.auth.server.store.StoreException;
import com.cgraph.auth.server.store.UserRecord;
import com.cgraph.auth.server.store.UserStore;
import com.cgraph.auth.server.store.WalletChallenge;
import com.cgraph.auth.server.store.WalletChallengeStore;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sign-in with a wallet signature over a single-use challenge.
 * <p>
 * The wallet signs {@code "Sign this message to authenticate with <app>.\n\nNonce: <nonce>"}
 * with {@code personal_sign}. The server recovers the signing address from the signature and
 * compares it with the claimed one. Every verification failure is reported as
 * {@code invalid_signature} without saying which step failed.
 * <p>
 * <strong>Replay protection:</strong> a verified challenge is removed with an atomic conditional
 * delete. Of two requests carrying the same valid signature only the one that wins the delete
 * succeeds; the other sees {@code challenge_not_found}.
 */
@Singleton
public class WalletChallengeAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(WalletChallengeAuthenticator.class);

  public static final Duration DEFAULT_CHALLENGE_TTL = Duration.ofMinutes(5);
  private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");
  private static final int NONCE_BYTES = 32;
  static final String USERNAME_PREFIX = "wallet_";

  private final WalletChallengeStore challengeStore;
  private final UserStore userStore;
  private final RandomProvider randomProvider;
  private final Clock clock;
  private final String appName;
  private final Duration challengeTtl;

  @Inject
  public WalletChallengeAuthenticator(WalletChallengeStore challengeStore, UserStore userStore,
                                      RandomProvider randomProvider, Clock clock, String appName,
                                      Duration challengeTtl) {
    this.challengeStore = challengeStore;
    this.userStore = userStore;
    this.randomProvider = randomProvider;
    this.clock = clock;
    this.appName = appName;
    this.challengeTtl = challengeTtl;
  }

  /**
   * Returns the live challenge for an address. Repeated requests inside the freshness window get
   * the same nonce; a stale challenge is rotated first.
   *
   * @param address {@code 0x} + 40 hex characters, any case
   * @return the challenge, or {@code invalid_request} for a malformed address
   */
  public AuthResult<WalletChallenge> issueChallenge(String address) {
    String normalized = normalize(address);
    if (!ADDRESS.matcher(normalized).matches()) {
      return AuthResult.failure(AuthError.INVALID_REQUEST);
    }
    Instant now = clock.instant();
    WalletChallenge candidate = new WalletChallenge(normalized,
        Hex.toHexString(randomProvider.randomBytes(NONCE_BYTES)), now);
    WalletChallenge live = challengeStore.getOrRotate(candidate, now.minus(challengeTtl));
    if (live == candidate) {
      log.debug("Issued new wallet challenge for {}", normalized);
    }
    return AuthResult.success(live);
  }

  /**
   * The exact text a wallet signs for a nonce.
   *
   * @param nonce challenge nonce
   * @return the message
   */
  public String challengeMessage(String nonce) {
    return "Sign this message to authenticate with " + appName + ".\n\nNonce: " + nonce;
  }

  /**
   * Verifies a signature over the address's live challenge, consumes the challenge and returns
   * the owning user, creating one on first sign-in.
   *
   * @param address   claimed address
   * @param signature hex {@code r || s || v}
   * @return the user, or {@code challenge_not_found}, {@code challenge_expired},
   *     {@code invalid_signature}
   */
  public AuthResult<UserRecord> verify(String address, String signature) {
    String normalized = normalize(address);
    Optional<WalletChallenge> found = challengeStore.find(normalized);
    if (found.isEmpty()) {
      return AuthResult.failure(AuthError.CHALLENGE_NOT_FOUND);
    }
    WalletChallenge challenge = found.get();
    if (challenge.isStale(clock.instant().minus(challengeTtl))) {
      return AuthResult.failure(AuthError.CHALLENGE_EXPIRED);
    }
    if (!signatureMatches(normalized, challenge.nonce(), signature)) {
      log.debug("Wallet signature rejected for {}", normalized);
      return AuthResult.failure(AuthError.INVALID_SIGNATURE);
    }
    if (!challengeStore.consume(challenge)) {
      log.debug("Wallet challenge for {} already consumed", normalized);
      return AuthResult.failure(AuthError.CHALLENGE_NOT_FOUND);
    }
    return AuthResult.success(findOrProvision(normalized));
  }

  private boolean signatureMatches(String address, String nonce, String signature) {
    Optional<RecoverableSignature> parsed = RecoverableSignature.parse(signature);
    if (parsed.isEmpty()) {
      return false;
    }
    byte[] digest = PersonalMessage.digest(challengeMessage(nonce));
    return Secp256k1.recoverAddress(digest, parsed.get())
        .map(recovered -> recovered.equalsIgnoreCase(address))
        .orElse(false);
  }

  private UserRecord findOrProvision(String address) {
    Optional<UserRecord> existing = userStore.findByWalletAddress(address);
    if (existing.isPresent()) {
      return existing.get();
    }
    // short handle first, full address if the short one collides
    for (String username : new String[]{
        USERNAME_PREFIX + address.substring(2, 10), USERNAME_PREFIX + address.substring(2)}) {
      UserRecord user = UserRecord.withWallet(UUID.randomUUID().toString(), address, username,
          clock.instant());
      if (userStore.insert(user)) {
        log.info("Provisioned wallet user={}", user.id());
        return user;
      }
      Optional<UserRecord> raced = userStore.findByWalletAddress(address);
      if (raced.isPresent()) {
        return raced.get();
      }
    }
    throw new StoreException("Unable to provision user for wallet " + address);
  }

  private static String normalize(String address) {
    return address == null ? "" : address.strip().toLowerCase(Locale.ROOT);
  }
}
