package com.cgraph.auth.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Dropwizard configuration for the authentication core.
 * <p>
 * For production, supply {@code jwtSecretHex} and {@code totpEncryptionKeyHex} (each a hex-encoded
 * random value of at least 32 bytes). Omitting either causes a random value to be generated on
 * each startup: issued tokens stop verifying, and stored second-factor secrets can no longer be
 * opened, after a restart.
 * <p>
 * Generate keys with: {@code openssl rand -hex 32}
 */
public class CgraphAuthConfiguration extends Configuration {

  /**
   * Application name. Appears verbatim in the wallet challenge message and is the TOTP issuer.
   */
  @NotEmpty
  private String appName = "CGraph";

  /**
   * Hex-encoded HMAC-SHA256 signing secret for bearer tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  @NotEmpty
  private String jwtIssuer = "cgraph";

  @Min(1)
  private long accessTokenTtlSeconds = 900;

  @Min(1)
  private long refreshTokenTtlSeconds = 2_592_000;

  @Min(1)
  private long secondFactorTokenTtlSeconds = 300;

  @Min(1)
  private int sessionTtlDays = 30;

  @Min(1)
  private long walletChallengeTtlSeconds = 300;

  @Min(1024)
  private int argon2MemoryKib = 65536;

  @Min(1)
  private int argon2Iterations = 3;

  @Min(1)
  private int argon2Parallelism = 1;

  /**
   * Hex-encoded key material for sealing second-factor secrets at rest.
   * Leave empty for random generation (dev only, enabled second factors break on restart).
   */
  private String totpEncryptionKeyHex = "";

  @Min(1)
  private int backupCodeCount = 10;

  @Valid
  @NotNull
  private BreachCheckConfiguration breachCheck = new BreachCheckConfiguration();

  @JsonProperty
  public String getAppName() {
    return appName;
  }

  @JsonProperty
  public void setAppName(String appName) {
    this.appName = appName;
  }

  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  @JsonProperty
  public long getAccessTokenTtlSeconds() {
    return accessTokenTtlSeconds;
  }

  @JsonProperty
  public void setAccessTokenTtlSeconds(long accessTokenTtlSeconds) {
    this.accessTokenTtlSeconds = accessTokenTtlSeconds;
  }

  @JsonProperty
  public long getRefreshTokenTtlSeconds() {
    return refreshTokenTtlSeconds;
  }

  @JsonProperty
  public void setRefreshTokenTtlSeconds(long refreshTokenTtlSeconds) {
    this.refreshTokenTtlSeconds = refreshTokenTtlSeconds;
  }

  @JsonProperty
  public long getSecondFactorTokenTtlSeconds() {
    return secondFactorTokenTtlSeconds;
  }

  @JsonProperty
  public void setSecondFactorTokenTtlSeconds(long secondFactorTokenTtlSeconds) {
    this.secondFactorTokenTtlSeconds = secondFactorTokenTtlSeconds;
  }

  @JsonProperty
  public int getSessionTtlDays() {
    return sessionTtlDays;
  }

  @JsonProperty
  public void setSessionTtlDays(int sessionTtlDays) {
    this.sessionTtlDays = sessionTtlDays;
  }

  @JsonProperty
  public long getWalletChallengeTtlSeconds() {
    return walletChallengeTtlSeconds;
  }

  @JsonProperty
  public void setWalletChallengeTtlSeconds(long walletChallengeTtlSeconds) {
    this.walletChallengeTtlSeconds = walletChallengeTtlSeconds;
  }

  @JsonProperty
  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  @JsonProperty
  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  @JsonProperty
  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  @JsonProperty
  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  @JsonProperty
  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  @JsonProperty
  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  @JsonProperty
  public String getTotpEncryptionKeyHex() {
    return totpEncryptionKeyHex;
  }

  @JsonProperty
  public void setTotpEncryptionKeyHex(String totpEncryptionKeyHex) {
    this.totpEncryptionKeyHex = totpEncryptionKeyHex;
  }

  @JsonProperty
  public int getBackupCodeCount() {
    return backupCodeCount;
  }

  @JsonProperty
  public void setBackupCodeCount(int backupCodeCount) {
    this.backupCodeCount = backupCodeCount;
  }

  @JsonProperty
  public BreachCheckConfiguration getBreachCheck() {
    return breachCheck;
  }

  @JsonProperty
  public void setBreachCheck(BreachCheckConfiguration breachCheck) {
    this.breachCheck = breachCheck;
  }
}
