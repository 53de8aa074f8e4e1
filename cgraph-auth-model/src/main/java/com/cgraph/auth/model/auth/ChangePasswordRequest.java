package com.cgraph.auth.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /auth/password}
 *
 * @param currentPassword the password being replaced
 * @param newPassword     the new password, at least eight characters
 */
public record ChangePasswordRequest(
    @JsonProperty("currentPassword") String currentPassword,
    @JsonProperty("newPassword") String newPassword) {
}
