package com.cgraph.auth.server.manager;

import com.cgraph.auth.server.store.UserRecord;
import com.cgraph.auth.server.token.TokenPair;

/**
 * Successful result of a login step.
 */
public sealed interface LoginOutcome permits LoginOutcome.Authenticated,
    LoginOutcome.SecondFactorRequired {

  String userId();

  /**
   * Fully authenticated: tokens minted and a session created.
   *
   * @param user    the principal
   * @param tokens  access and refresh token
   * @param session the new session and its raw token
   */
  record Authenticated(UserRecord user, TokenPair tokens, IssuedSession session)
      implements LoginOutcome {
    @Override
    public String userId() {
      return user.id();
    }
  }

  /**
   * First factor accepted; the account needs a second factor before tokens are minted.
   *
   * @param userId       the user
   * @param pendingToken short-lived token to present with the code
   */
  record SecondFactorRequired(String userId, String pendingToken) implements LoginOutcome {
  }
}
