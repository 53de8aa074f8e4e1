package com.cgraph.auth.dropwizard.auth;

import com.cgraph.auth.server.manager.AuthenticationService;
import com.cgraph.auth.server.result.AuthResult;
import com.cgraph.auth.server.store.UserRecord;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard {@link Authenticator} that accepts access tokens of active users through
 * {@link AuthenticationService}. Refresh and second-factor tokens are refused.
 */
public class BearerTokenAuthenticator implements Authenticator<String, CgraphPrincipal> {

  private static final Logger log = LoggerFactory.getLogger(BearerTokenAuthenticator.class);

  private final AuthenticationService authenticationService;

  public BearerTokenAuthenticator(AuthenticationService authenticationService) {
    this.authenticationService = authenticationService;
  }

  @Override
  public Optional<CgraphPrincipal> authenticate(String token) throws AuthenticationException {
    AuthResult<UserRecord> user = authenticationService.authenticateAccessToken(token);
    if (!user.isSuccess()) {
      log.debug("Bearer token rejected: {}", user.getError().code());
      return Optional.empty();
    }
    UserRecord record = user.get();
    return Optional.of(new CgraphPrincipal(record.id(), record.email(), record.walletAddress()));
  }
}
