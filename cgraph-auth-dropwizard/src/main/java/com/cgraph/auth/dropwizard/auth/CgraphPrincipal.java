package com.cgraph.auth.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing the active user behind a verified access token.
 *
 * @param userId        the user id, also the token subject
 * @param email         email, null for wallet-only accounts
 * @param walletAddress bound wallet address, may be null
 */
public record CgraphPrincipal(String userId, String email, String walletAddress) implements Principal {

  @Override
  public String getName() {
    return userId;
  }
}
