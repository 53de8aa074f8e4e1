package com.cgraph.auth.server.token;

import java.time.Instant;

/**
 * Claims of a token that passed verification.
 *
 * @param subject   user id
 * @param jti       token id
 * @param type      token type
 * @param issuedAt  issue time, whole seconds
 * @param expiresAt expiry
 */
public record VerifiedToken(String subject, String jti, TokenType type, Instant issuedAt,
                            Instant expiresAt) {
}
