package com.cgraph.auth.model.wallet;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /auth/wallet/challenge}
 *
 * @param address {@code 0x} + 40 hex characters, any case
 */
public record WalletChallengeRequest(@JsonProperty("address") String address) {
}
