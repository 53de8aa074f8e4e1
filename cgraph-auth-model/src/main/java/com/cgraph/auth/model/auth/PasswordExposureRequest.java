package com.cgraph.auth.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /auth/password/exposure}
 *
 * @param password the password to look up in the breach corpus
 */
public record PasswordExposureRequest(@JsonProperty("password") String password) {
}
