package com.cgraph.auth.server.result;

/**
 * Expected, user-facing failure kinds. The set is deliberately coarse where finer detail would
 * let a caller enumerate accounts or tell verification steps apart.
 */
public enum AuthError {
  INVALID_CREDENTIALS("invalid_credentials"),
  INVALID_SIGNATURE("invalid_signature"),
  CHALLENGE_NOT_FOUND("challenge_not_found"),
  CHALLENGE_EXPIRED("challenge_expired"),
  TOTP_NOT_ENABLED("totp_not_enabled"),
  INVALID_CODE("invalid_code"),
  ALREADY_ENABLED("already_enabled"),
  NO_BACKUP_CODES("no_backup_codes"),
  TOKEN_EXPIRED("token_expired"),
  TOKEN_WRONG_TYPE("token_wrong_type"),
  TOKEN_MALFORMED("token_malformed"),
  TOKEN_REVOKED("token_revoked"),
  RATE_LIMITED("rate_limited"),
  ACCOUNT_DISABLED("account_disabled"),
  ALREADY_REGISTERED("already_registered"),
  SESSION_NOT_FOUND("session_not_found"),
  INVALID_REQUEST("invalid_request");

  private final String code;

  AuthError(String code) {
    this.code = code;
  }

  /**
   * Stable wire code.
   *
   * @return snake_case code
   */
  public String code() {
    return code;
  }
}
