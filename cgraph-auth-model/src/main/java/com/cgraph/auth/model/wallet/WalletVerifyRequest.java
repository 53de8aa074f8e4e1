package com.cgraph.auth.model.wallet;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /auth/wallet/verify}
 *
 * @param address   the address that requested the challenge
 * @param signature 65 byte {@code r || s || v} signature as hex, {@code 0x} optional
 */
public record WalletVerifyRequest(
    @JsonProperty("address") String address,
    @JsonProperty("signature") String signature) {
}
