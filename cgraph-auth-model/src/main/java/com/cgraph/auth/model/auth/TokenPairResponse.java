package com.cgraph.auth.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A freshly minted access and refresh token.
 *
 * @param accessToken  short-lived bearer token
 * @param refreshToken replacement refresh token; the presented one is spent
 * @param expiresIn    access token lifetime in seconds
 */
public record TokenPairResponse(
    @JsonProperty("accessToken") String accessToken,
    @JsonProperty("refreshToken") String refreshToken,
    @JsonProperty("expiresIn") long expiresIn) {
}
