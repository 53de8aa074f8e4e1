package com.cgraph.auth.server.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.cgraph.auth.model.error.ErrorResponse;
import com.cgraph.auth.server.manager.SessionContext;
import com.cgraph.auth.server.result.AuthError;
import com.cgraph.auth.server.result.AuthResult;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.WebApplicationException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AuthResponsesTest {

  @BeforeAll
  static void installRuntimeDelegate() {
    RecordingRuntimeDelegate.install();
  }

  @AfterAll
  static void removeRuntimeDelegate() {
    RecordingRuntimeDelegate.uninstall();
  }

  @ParameterizedTest
  @CsvSource({
      "INVALID_CREDENTIALS, 401",
      "INVALID_SIGNATURE, 401",
      "INVALID_CODE, 401",
      "TOKEN_EXPIRED, 401",
      "TOKEN_REVOKED, 401",
      "ACCOUNT_DISABLED, 403",
      "CHALLENGE_NOT_FOUND, 404",
      "SESSION_NOT_FOUND, 404",
      "CHALLENGE_EXPIRED, 410",
      "ALREADY_REGISTERED, 409",
      "ALREADY_ENABLED, 409",
      "RATE_LIMITED, 429",
      "INVALID_REQUEST, 400",
      "TOTP_NOT_ENABLED, 400",
      "NO_BACKUP_CODES, 400"
  })
  void status_mapsEveryError(AuthError error, int expected) {
    assertThat(AuthResponses.status(error)).isEqualTo(expected);
  }

  @Test
  void unwrap_failure_throwsWithErrorBody() {
    assertThatThrownBy(() -> AuthResponses.unwrap(AuthResult.failure(AuthError.CHALLENGE_EXPIRED)))
        .isInstanceOfSatisfying(WebApplicationException.class, e -> {
          assertThat(e.getResponse().getStatus()).isEqualTo(410);
          assertThat(e.getResponse().getEntity()).isEqualTo(new ErrorResponse("challenge_expired"));
        });
  }

  @Test
  void require_blankOrNull_isInvalidRequest() {
    assertThat(AuthResponses.require("x")).isEqualTo("x");
    assertThatThrownBy(() -> AuthResponses.require(" "))
        .isInstanceOfSatisfying(WebApplicationException.class,
            e -> assertThat(e.getResponse().getStatus()).isEqualTo(400));
    assertThatThrownBy(() -> AuthResponses.require(null)).isInstanceOf(WebApplicationException.class);
  }

  @Test
  void sessionContext_readsServletRequest() {
    HttpServletRequest request = mock(HttpServletRequest.class);
    when(request.getHeader("User-Agent")).thenReturn("curl/8");
    when(request.getHeader("X-Forwarded-For")).thenReturn("203.0.113.9, 10.0.0.1");
    when(request.getRemoteAddr()).thenReturn("10.0.0.1");

    assertThat(AuthResponses.sessionContext(request))
        .isEqualTo(new SessionContext("curl/8", "203.0.113.9"));
    assertThat(AuthResponses.sessionContext(null)).isEqualTo(SessionContext.UNKNOWN);
  }
}
