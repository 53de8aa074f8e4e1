package com.cgraph.auth.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /auth/logout}
 *
 * @param sessionToken raw session handle issued at login
 */
public record LogoutRequest(@JsonProperty("sessionToken") String sessionToken) {
}
