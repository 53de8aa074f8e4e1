package com.cgraph.auth.server.resource;

import com.cgraph.auth.model.secondfactor.BackupCodesResponse;
import com.cgraph.auth.model.secondfactor.RemainingBackupCodesResponse;
import com.cgraph.auth.model.secondfactor.SecondFactorCodeRequest;
import com.cgraph.auth.model.secondfactor.SecondFactorEnableRequest;
import com.cgraph.auth.model.secondfactor.SecondFactorSetupResponse;
import com.cgraph.auth.server.manager.AuthenticationService;
import com.cgraph.auth.server.manager.SecondFactorEngine;
import com.cgraph.auth.server.manager.SecondFactorSetup;
import com.cgraph.auth.server.store.UserRecord;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Second-factor management for the bearer of an access token.
 * <p>
 * Endpoints: {@code /auth/2fa/setup}, {@code /enable}, {@code /verify}, {@code /disable},
 * {@code /backup-codes/regenerate}, {@code /backup-codes/use}.
 */
@Path("/auth/2fa")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SecondFactorResource {

  private final SecondFactorEngine engine;
  private final AuthenticationService authenticationService;

  public SecondFactorResource(SecondFactorEngine engine, AuthenticationService authenticationService) {
    this.engine = engine;
    this.authenticationService = authenticationService;
  }

  @POST
  @Path("/setup")
  public SecondFactorSetupResponse setup(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
    UserRecord user = AuthResponses.requireUser(authenticationService, authorization);
    SecondFactorSetup setup = AuthResponses.unwrap(engine.setup(user.id()));
    return new SecondFactorSetupResponse(setup.secretBase32(), setup.provisioningUri(),
        setup.backupCodes());
  }

  @POST
  @Path("/enable")
  public Response enable(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                         SecondFactorEnableRequest req) {
    UserRecord user = AuthResponses.requireUser(authenticationService, authorization);
    AuthResponses.require(req);
    AuthResponses.unwrap(engine.enable(user.id(), AuthResponses.require(req.code()), req.secret(),
        req.backupCodes()));
    return Response.noContent().build();
  }

  @POST
  @Path("/verify")
  public Response verify(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                         SecondFactorCodeRequest req) {
    UserRecord user = AuthResponses.requireUser(authenticationService, authorization);
    AuthResponses.require(req);
    AuthResponses.unwrap(engine.verify(user.id(), AuthResponses.require(req.code())));
    return Response.noContent().build();
  }

  @POST
  @Path("/disable")
  public RemainingBackupCodesResponse disable(
      @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization, SecondFactorCodeRequest req) {
    UserRecord user = AuthResponses.requireUser(authenticationService, authorization);
    AuthResponses.require(req);
    return new RemainingBackupCodesResponse(
        AuthResponses.unwrap(engine.disable(user.id(), AuthResponses.require(req.code()))));
  }

  @POST
  @Path("/backup-codes/regenerate")
  public BackupCodesResponse regenerate(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                        SecondFactorCodeRequest req) {
    UserRecord user = AuthResponses.requireUser(authenticationService, authorization);
    AuthResponses.require(req);
    return new BackupCodesResponse(AuthResponses.unwrap(
        engine.regenerateBackupCodes(user.id(), AuthResponses.require(req.code()))));
  }

  @POST
  @Path("/backup-codes/use")
  public RemainingBackupCodesResponse useBackupCode(
      @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization, SecondFactorCodeRequest req) {
    UserRecord user = AuthResponses.requireUser(authenticationService, authorization);
    AuthResponses.require(req);
    return new RemainingBackupCodesResponse(
        AuthResponses.unwrap(engine.useBackupCode(user.id(), AuthResponses.require(req.code()))));
  }
}
