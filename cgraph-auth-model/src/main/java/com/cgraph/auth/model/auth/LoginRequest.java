package com.cgraph.auth.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for email and password login.
 * <p>
 * Used by: {@code POST /auth/login}
 *
 * @param email    email address
 * @param password plaintext password
 */
public record LoginRequest(
    @JsonProperty("email") String email,
    @JsonProperty("password") String password) {
}
