package com.cgraph.auth.server.token;

/**
 * Value of the {@code typ} claim. A token is only accepted where its type is expected.
 */
public enum TokenType {
  ACCESS("access"),
  REFRESH("refresh"),
  SECOND_FACTOR("second_factor");

  private final String claim;

  TokenType(String claim) {
    this.claim = claim;
  }

  public String claim() {
    return claim;
  }
}
