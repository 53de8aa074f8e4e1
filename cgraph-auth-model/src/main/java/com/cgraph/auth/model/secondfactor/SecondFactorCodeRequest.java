package com.cgraph.auth.model.secondfactor;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single code: a six digit time-based code or a backup code depending on the endpoint.
 * <p>
 * Used by: {@code /auth/2fa/verify}, {@code /auth/2fa/disable},
 * {@code /auth/2fa/backup-codes/regenerate}, {@code /auth/2fa/backup-codes/use}
 *
 * @param code the submitted code
 */
public record SecondFactorCodeRequest(@JsonProperty("code") String code) {
}
