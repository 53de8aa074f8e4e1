package com.cgraph.auth.server.manager;

/**
 * What a client presents to log in. The set of variants is closed and every consumer handles all
 * of them through {@link Visitor}.
 */
public sealed interface Credential permits Credential.Password, Credential.Wallet,
    Credential.SecondFactorCode, Credential.BackupCode {

  <R> R accept(Visitor<R> visitor);

  /**
   * One handler per variant.
   *
   * @param <R> result type
   */
  interface Visitor<R> {

    R visitPassword(Password credential);

    R visitWallet(Wallet credential);

    R visitSecondFactorCode(SecondFactorCode credential);

    R visitBackupCode(BackupCode credential);
  }

  record Password(String email, String password) implements Credential {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPassword(this);
    }

    @Override
    public String toString() {
      return "Password[email=" + email + "]";
    }
  }

  record Wallet(String address, String signature) implements Credential {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitWallet(this);
    }
  }

  /**
   * Second step of a login that returned {@link LoginOutcome.SecondFactorRequired}.
   *
   * @param pendingToken token from the first step
   * @param code         time-based code
   */
  record SecondFactorCode(String pendingToken, String code) implements Credential {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSecondFactorCode(this);
    }
  }

  /**
   * Second step completed with a backup code instead of a time-based code.
   *
   * @param pendingToken token from the first step
   * @param code         backup code
   */
  record BackupCode(String pendingToken, String code) implements Credential {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBackupCode(this);
    }
  }
}
