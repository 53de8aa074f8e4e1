package com.cgraph.auth.server.resource;

import com.cgraph.auth.model.auth.ChangePasswordRequest;
import com.cgraph.auth.model.auth.LoginRequest;
import com.cgraph.auth.model.auth.LoginResponse;
import com.cgraph.auth.model.auth.LogoutRequest;
import com.cgraph.auth.model.auth.PasswordExposureRequest;
import com.cgraph.auth.model.auth.PasswordExposureResponse;
import com.cgraph.auth.model.auth.RefreshRequest;
import com.cgraph.auth.model.auth.RegisterRequest;
import com.cgraph.auth.model.auth.SecondFactorLoginRequest;
import com.cgraph.auth.model.auth.TokenPairResponse;
import com.cgraph.auth.server.breach.BreachCheckService;
import com.cgraph.auth.server.breach.BreachStatus;
import com.cgraph.auth.server.manager.AuthenticationService;
import com.cgraph.auth.server.manager.Credential;
import com.cgraph.auth.server.manager.PasswordAuthenticator;
import com.cgraph.auth.server.store.UserRecord;
import com.cgraph.auth.server.token.TokenPair;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Password login, registration and token lifecycle.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /auth/register}</li>
 *   <li>{@code POST /auth/login}</li>
 *   <li>{@code POST /auth/login/second-factor}</li>
 *   <li>{@code POST /auth/refresh}</li>
 *   <li>{@code POST /auth/logout}</li>
 *   <li>{@code POST /auth/password} (bearer)</li>
 *   <li>{@code POST /auth/password/exposure} (bearer)</li>
 * </ul>
 */
@Path("/auth")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

  private static final Logger log = LoggerFactory.getLogger(AuthResource.class);

  private final AuthenticationService authenticationService;
  private final PasswordAuthenticator passwordAuthenticator;
  private final BreachCheckService breachCheckService;

  public AuthResource(AuthenticationService authenticationService,
                      PasswordAuthenticator passwordAuthenticator,
                      BreachCheckService breachCheckService) {
    this.authenticationService = authenticationService;
    this.passwordAuthenticator = passwordAuthenticator;
    this.breachCheckService = breachCheckService;
  }

  @POST
  @Path("/register")
  public LoginResponse register(RegisterRequest req, @Context HttpServletRequest http) {
    log.debug("register()");
    AuthResponses.require(req);
    return AuthResponses.toLoginResponse(AuthResponses.unwrap(authenticationService.register(
        req.email(), req.username(), req.password(), AuthResponses.sessionContext(http))));
  }

  @POST
  @Path("/login")
  public LoginResponse login(LoginRequest req, @Context HttpServletRequest http) {
    log.debug("login()");
    AuthResponses.require(req);
    return AuthResponses.toLoginResponse(AuthResponses.unwrap(authenticationService.login(
        new Credential.Password(req.email(), req.password()), AuthResponses.sessionContext(http))));
  }

  /**
   * Completes a login that returned {@code second_factor_required}. A backup code is used when
   * {@code backupCode} is present, otherwise {@code code} must be a time-based code.
   */
  @POST
  @Path("/login/second-factor")
  public LoginResponse loginSecondFactor(SecondFactorLoginRequest req,
                                         @Context HttpServletRequest http) {
    log.debug("loginSecondFactor()");
    AuthResponses.require(req);
    String pending = AuthResponses.require(req.secondFactorToken());
    Credential credential = req.backupCode() != null && !req.backupCode().isBlank()
        ? new Credential.BackupCode(pending, req.backupCode())
        : new Credential.SecondFactorCode(pending, AuthResponses.require(req.code()));
    return AuthResponses.toLoginResponse(AuthResponses.unwrap(
        authenticationService.login(credential, AuthResponses.sessionContext(http))));
  }

  @POST
  @Path("/refresh")
  public TokenPairResponse refresh(RefreshRequest req) {
    log.debug("refresh()");
    AuthResponses.require(req);
    TokenPair pair = AuthResponses.unwrap(
        authenticationService.refresh(AuthResponses.require(req.refreshToken())));
    return new TokenPairResponse(pair.accessToken(), pair.refreshToken(), pair.expiresInSeconds());
  }

  @POST
  @Path("/logout")
  public Response logout(LogoutRequest req) {
    log.debug("logout()");
    AuthResponses.require(req);
    AuthResponses.unwrap(authenticationService.logout(AuthResponses.require(req.sessionToken())));
    return Response.noContent().build();
  }

  @POST
  @Path("/password")
  public Response changePassword(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                 ChangePasswordRequest req) {
    UserRecord user = AuthResponses.requireUser(authenticationService, authorization);
    AuthResponses.require(req);
    AuthResponses.unwrap(passwordAuthenticator.changePassword(user.id(), req.currentPassword(),
        req.newPassword()));
    return Response.noContent().build();
  }

  @POST
  @Path("/password/exposure")
  public PasswordExposureResponse passwordExposure(
      @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization, PasswordExposureRequest req) {
    UserRecord user = AuthResponses.requireUser(authenticationService, authorization);
    AuthResponses.require(req);
    BreachStatus status = AuthResponses.unwrap(
        breachCheckService.checkExposure(user.id(), AuthResponses.require(req.password())));
    return new PasswordExposureResponse(status.breached(), status.occurrences());
  }
}
