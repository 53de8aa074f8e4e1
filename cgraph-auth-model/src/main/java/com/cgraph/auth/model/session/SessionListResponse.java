package com.cgraph.auth.model.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Used by: {@code GET /auth/sessions}
 *
 * @param sessions active sessions, most recently active first
 */
public record SessionListResponse(@JsonProperty("sessions") List<SessionView> sessions) {
}
