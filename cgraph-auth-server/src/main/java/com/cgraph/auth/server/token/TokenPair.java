package com.cgraph.auth.server.token;

/**
 * Access and refresh token minted together.
 *
 * @param accessToken      signed access token
 * @param refreshToken     signed refresh token
 * @param expiresInSeconds access token lifetime
 */
public record TokenPair(String accessToken, String refreshToken, long expiresInSeconds) {
}
