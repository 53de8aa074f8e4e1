package com.cgraph.auth.server.resource;

import com.cgraph.auth.model.auth.LoginResponse;
import com.cgraph.auth.model.error.ErrorResponse;
import com.cgraph.auth.server.manager.AuthenticationService;
import com.cgraph.auth.server.manager.LoginOutcome;
import com.cgraph.auth.server.manager.SessionContext;
import com.cgraph.auth.server.result.AuthError;
import com.cgraph.auth.server.result.AuthResult;
import com.cgraph.auth.server.store.UserRecord;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Translation between core results and HTTP for the JAX-RS resources.
 */
public final class AuthResponses {

  private static final String BEARER = "Bearer ";

  private AuthResponses() {
  }

  /**
   * HTTP status for an error kind.
   *
   * @param error the error
   * @return status code
   */
  public static int status(AuthError error) {
    switch (error) {
      case INVALID_CREDENTIALS:
      case INVALID_SIGNATURE:
      case INVALID_CODE:
      case TOKEN_EXPIRED:
      case TOKEN_WRONG_TYPE:
      case TOKEN_MALFORMED:
      case TOKEN_REVOKED:
        return 401;
      case ACCOUNT_DISABLED:
        return 403;
      case CHALLENGE_NOT_FOUND:
      case SESSION_NOT_FOUND:
        return 404;
      case CHALLENGE_EXPIRED:
        return 410;
      case ALREADY_ENABLED:
      case ALREADY_REGISTERED:
        return 409;
      case RATE_LIMITED:
        return 429;
      case INVALID_REQUEST:
      case TOTP_NOT_ENABLED:
      case NO_BACKUP_CODES:
      default:
        return 400;
    }
  }

  /**
   * The exception JAX-RS turns into the error response for {@code error}.
   *
   * @param error the error
   * @return exception carrying a JSON {@link ErrorResponse}
   */
  public static WebApplicationException failure(AuthError error) {
    return new WebApplicationException(error.code(), Response.status(status(error))
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(error.code()))
        .build());
  }

  /**
   * Returns the success value or throws the mapped HTTP failure.
   *
   * @param result core result
   * @param <T>    value type
   * @return the value
   */
  public static <T> T unwrap(AuthResult<T> result) {
    if (!result.isSuccess()) {
      throw failure(result.getError());
    }
    return result.get();
  }

  /**
   * Rejects missing request bodies and blank required fields with {@code invalid_request}.
   *
   * @param value field or body
   * @param <T>   type
   * @return the value
   */
  public static <T> T require(T value) {
    if (value == null || (value instanceof String s && s.isBlank())) {
      throw failure(AuthError.INVALID_REQUEST);
    }
    return value;
  }

  /**
   * Resolves the active user behind an {@code Authorization: Bearer} header.
   *
   * @param service       authentication service
   * @param authorization header value
   * @return the user
   */
  public static UserRecord requireUser(AuthenticationService service, String authorization) {
    if (authorization == null || !authorization.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
      throw failure(AuthError.TOKEN_MALFORMED);
    }
    return unwrap(service.authenticateAccessToken(authorization.substring(BEARER.length()).strip()));
  }

  /**
   * Session metadata from the servlet request.
   *
   * @param request the request, may be null outside a servlet container
   * @return the context
   */
  public static SessionContext sessionContext(HttpServletRequest request) {
    if (request == null) {
      return SessionContext.UNKNOWN;
    }
    return SessionContext.of(request.getHeader(HttpHeaders.USER_AGENT),
        request.getHeader("X-Forwarded-For"), request.getRemoteAddr());
  }

  static LoginResponse toLoginResponse(LoginOutcome outcome) {
    if (outcome instanceof LoginOutcome.Authenticated authenticated) {
      return LoginResponse.authenticated(authenticated.userId(),
          authenticated.tokens().accessToken(),
          authenticated.tokens().refreshToken(),
          authenticated.session().rawToken(),
          authenticated.tokens().expiresInSeconds());
    }
    LoginOutcome.SecondFactorRequired pending = (LoginOutcome.SecondFactorRequired) outcome;
    return LoginResponse.secondFactorRequired(pending.userId(), pending.pendingToken());
  }
}
