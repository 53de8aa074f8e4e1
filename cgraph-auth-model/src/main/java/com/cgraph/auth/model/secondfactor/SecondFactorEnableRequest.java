package com.cgraph.auth.model.secondfactor;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Used by: {@code POST /auth/2fa/enable}
 *
 * @param code        current code generated from {@code secret}
 * @param secret      Base32 secret from the setup response
 * @param backupCodes backup codes from the setup response
 */
public record SecondFactorEnableRequest(
    @JsonProperty("code") String code,
    @JsonProperty("secret") String secret,
    @JsonProperty("backupCodes") List<String> backupCodes) {
}
