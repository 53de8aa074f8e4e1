package com.cgraph.auth.model.auth;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model returned by every login path (password, wallet, second-factor completion,
 * registration).
 * <p>
 * When {@code status} is {@code authenticated} the token fields are set. When it is
 * {@code second_factor_required} only {@code secondFactorToken} is set; the client posts it back
 * to {@code /auth/login/second-factor} together with a code.
 *
 * @param status            {@code authenticated} or {@code second_factor_required}
 * @param userId            the principal's id
 * @param accessToken       short-lived bearer token
 * @param refreshToken      long-lived refresh token
 * @param sessionToken      raw session handle; only its hash is kept server-side
 * @param expiresIn         access token lifetime in seconds
 * @param secondFactorToken short-lived token binding the pending second-factor step
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginResponse(
    @JsonProperty("status") String status,
    @JsonProperty("userId") String userId,
    @JsonProperty("accessToken") String accessToken,
    @JsonProperty("refreshToken") String refreshToken,
    @JsonProperty("sessionToken") String sessionToken,
    @JsonProperty("expiresIn") Long expiresIn,
    @JsonProperty("secondFactorToken") String secondFactorToken) {

  public static final String AUTHENTICATED = "authenticated";
  public static final String SECOND_FACTOR_REQUIRED = "second_factor_required";

  public static LoginResponse authenticated(String userId, String accessToken, String refreshToken,
                                            String sessionToken, long expiresIn) {
    return new LoginResponse(AUTHENTICATED, userId, accessToken, refreshToken, sessionToken,
        expiresIn, null);
  }

  public static LoginResponse secondFactorRequired(String userId, String secondFactorToken) {
    return new LoginResponse(SECOND_FACTOR_REQUIRED, userId, null, null, null, null,
        secondFactorToken);
  }
}
