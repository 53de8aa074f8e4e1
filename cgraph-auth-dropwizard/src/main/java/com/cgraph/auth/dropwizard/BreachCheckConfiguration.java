package com.cgraph.auth.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Settings for the password breach lookup against a Pwned Passwords style range endpoint.
 */
public class BreachCheckConfiguration {

  private boolean enabled = true;

  @NotEmpty
  private String endpoint = "https://api.pwnedpasswords.com/range/";

  @Min(1)
  private long timeoutMillis = 3000;

  @Min(0)
  private long cacheTtlSeconds = 86400;

  /**
   * Per-user window for breach finding logs and for on-demand exposure checks.
   */
  @Min(0)
  private long logCooldownSeconds = 3600;

  @JsonProperty
  public boolean isEnabled() {
    return enabled;
  }

  @JsonProperty
  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  @JsonProperty
  public String getEndpoint() {
    return endpoint;
  }

  @JsonProperty
  public void setEndpoint(String endpoint) {
    this.endpoint = endpoint;
  }

  @JsonProperty
  public long getTimeoutMillis() {
    return timeoutMillis;
  }

  @JsonProperty
  public void setTimeoutMillis(long timeoutMillis) {
    this.timeoutMillis = timeoutMillis;
  }

  @JsonProperty
  public long getCacheTtlSeconds() {
    return cacheTtlSeconds;
  }

  @JsonProperty
  public void setCacheTtlSeconds(long cacheTtlSeconds) {
    this.cacheTtlSeconds = cacheTtlSeconds;
  }

  @JsonProperty
  public long getLogCooldownSeconds() {
    return logCooldownSeconds;
  }

  @JsonProperty
  public void setLogCooldownSeconds(long logCooldownSeconds) {
    this.logCooldownSeconds = logCooldownSeconds;
  }
}
