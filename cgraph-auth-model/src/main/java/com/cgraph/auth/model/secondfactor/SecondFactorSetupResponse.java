package com.cgraph.auth.model.secondfactor;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Candidate second-factor material. Nothing is stored until the client echoes it back to
 * {@code /auth/2fa/enable} with a valid code.
 *
 * @param secret          Base32 secret for manual entry
 * @param provisioningUri {@code otpauth://} URI for QR rendering
 * @param backupCodes     plaintext backup codes, shown once
 */
public record SecondFactorSetupResponse(
    @JsonProperty("secret") String secret,
    @JsonProperty("provisioningUri") String provisioningUri,
    @JsonProperty("backupCodes") List<String> backupCodes) {
}
