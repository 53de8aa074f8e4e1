package com.cgraph.auth.model.wallet;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The challenge a wallet must sign. Clients sign {@code message} verbatim with
 * {@code personal_sign}.
 *
 * @param address normalized (lower-case) address
 * @param nonce   64 hex character single-use nonce
 * @param message exact text to sign
 */
public record WalletChallengeResponse(
    @JsonProperty("address") String address,
    @JsonProperty("nonce") String nonce,
    @JsonProperty("message") String message) {
}
