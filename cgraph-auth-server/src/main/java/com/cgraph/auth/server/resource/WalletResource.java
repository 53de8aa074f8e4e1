package com.cgraph.auth.server.resource;

import com.cgraph.auth.model.auth.LoginResponse;
import com.cgraph.auth.model.wallet.WalletChallengeRequest;
import com.cgraph.auth.model.wallet.WalletChallengeResponse;
import com.cgraph.auth.model.wallet.WalletVerifyRequest;
import com.cgraph.auth.server.manager.AuthenticationService;
import com.cgraph.auth.server.manager.Credential;
import com.cgraph.auth.server.manager.WalletChallengeAuthenticator;
import com.cgraph.auth.server.store.WalletChallenge;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wallet sign-in: {@code POST /auth/wallet/challenge} then {@code POST /auth/wallet/verify}.
 */
@Path("/auth/wallet")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class WalletResource {

  private static final Logger log = LoggerFactory.getLogger(WalletResource.class);

  private final WalletChallengeAuthenticator walletAuthenticator;
  private final AuthenticationService authenticationService;

  public WalletResource(WalletChallengeAuthenticator walletAuthenticator,
                        AuthenticationService authenticationService) {
    this.walletAuthenticator = walletAuthenticator;
    this.authenticationService = authenticationService;
  }

  @POST
  @Path("/challenge")
  public WalletChallengeResponse challenge(WalletChallengeRequest req) {
    log.debug("challenge()");
    AuthResponses.require(req);
    WalletChallenge challenge = AuthResponses.unwrap(
        walletAuthenticator.issueChallenge(AuthResponses.require(req.address())));
    return new WalletChallengeResponse(challenge.address(), challenge.nonce(),
        walletAuthenticator.challengeMessage(challenge.nonce()));
  }

  @POST
  @Path("/verify")
  public LoginResponse verify(WalletVerifyRequest req, @Context HttpServletRequest http) {
    log.debug("verify()");
    AuthResponses.require(req);
    Credential credential = new Credential.Wallet(AuthResponses.require(req.address()),
        AuthResponses.require(req.signature()));
    return AuthResponses.toLoginResponse(AuthResponses.unwrap(
        authenticationService.login(credential, AuthResponses.sessionContext(http))));
  }
}
