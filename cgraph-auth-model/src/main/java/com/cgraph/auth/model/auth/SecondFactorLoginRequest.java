package com.cgraph.auth.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model completing a login that stopped at {@code second_factor_required}. Exactly one of
 * {@code code} and {@code backupCode} is expected.
 * <p>
 * Used by: {@code POST /auth/login/second-factor}
 *
 * @param secondFactorToken token from the first login step
 * @param code              current six digit code
 * @param backupCode        unused backup code, any case, dash optional
 */
public record SecondFactorLoginRequest(
    @JsonProperty("secondFactorToken") String secondFactorToken,
    @JsonProperty("code") String code,
    @JsonProperty("backupCode") String backupCode) {
}
