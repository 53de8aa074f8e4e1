package com.cgraph.auth.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for password registration.
 * <p>
 * Used by: {@code POST /auth/register}
 *
 * @param email    email address, compared case-insensitively
 * @param username optional display handle; derived from the email when absent
 * @param password plaintext password, at least eight characters
 */
public record RegisterRequest(
    @JsonProperty("email") String email,
    @JsonProperty("username") String username,
    @JsonProperty("password") String password) {
}
