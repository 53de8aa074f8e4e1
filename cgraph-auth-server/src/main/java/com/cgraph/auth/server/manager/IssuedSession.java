package com.cgraph.auth.server.manager;

import com.cgraph.auth.server.store.Session;

/**
 * A freshly created session together with its raw token. The raw token exists only here and in
 * the response to the client.
 *
 * @param session  stored record
 * @param rawToken URL-safe Base64 token handed to the client
 */
public record IssuedSession(Session session, String rawToken) {
}
