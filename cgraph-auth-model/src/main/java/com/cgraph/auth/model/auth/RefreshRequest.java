package com.cgraph.auth.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /auth/refresh}
 *
 * @param refreshToken the refresh token from the last login or refresh
 */
public record RefreshRequest(@JsonProperty("refreshToken") String refreshToken) {
}
