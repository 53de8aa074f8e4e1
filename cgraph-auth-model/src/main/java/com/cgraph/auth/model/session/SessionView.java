package com.cgraph.auth.model.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An active session as shown to its owner. Timestamps are ISO-8601 UTC.
 *
 * @param id           session id, usable with {@code DELETE /auth/sessions/{id}}
 * @param userAgent    user agent captured at login
 * @param ipAddress    client address captured at login
 * @param createdAt    creation time
 * @param lastActiveAt last time the session token was presented
 * @param expiresAt    natural expiry
 */
public record SessionView(
    @JsonProperty("id") String id,
    @JsonProperty("userAgent") String userAgent,
    @JsonProperty("ipAddress") String ipAddress,
    @JsonProperty("createdAt") String createdAt,
    @JsonProperty("lastActiveAt") String lastActiveAt,
    @JsonProperty("expiresAt") String expiresAt) {
}
