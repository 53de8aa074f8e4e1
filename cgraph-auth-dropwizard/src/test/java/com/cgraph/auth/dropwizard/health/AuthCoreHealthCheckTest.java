package com.cgraph.auth.dropwizard.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.cgraph.auth.crypto.common.RandomProvider;
import com.cgraph.auth.crypto.password.Argon2PasswordHasher;
import com.cgraph.auth.crypto.password.Argon2Settings;
import com.cgraph.auth.server.result.AuthError;
import com.cgraph.auth.server.result.AuthResult;
import com.cgraph.auth.server.store.InMemoryRefreshTokenDenylist;
import com.cgraph.auth.server.store.InMemoryUserStore;
import com.cgraph.auth.server.token.TokenIssuer;
import com.cgraph.auth.server.token.TokenPair;
import com.cgraph.auth.server.token.TokenSettings;
import com.cgraph.auth.server.token.TokenType;
import com.codahale.metrics.health.HealthCheck;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import org.junit.jupiter.api.Test;

class AuthCoreHealthCheckTest {

  private static final byte[] SECRET =
      "health-secret-must-be-at-least-32-bytes".getBytes(StandardCharsets.UTF_8);

  private final Argon2PasswordHasher hasher =
      new Argon2PasswordHasher(new Argon2Settings(1024, 1, 1), new RandomProvider());

  @Test
  void execute_workingPrimitives_isHealthy() {
    TokenIssuer issuer = new TokenIssuer(
        new TokenSettings(SECRET, "cgraph-test", TokenSettings.DEFAULT_ACCESS_TTL,
            TokenSettings.DEFAULT_REFRESH_TTL, TokenSettings.DEFAULT_SECOND_FACTOR_TTL),
        new InMemoryRefreshTokenDenylist(), new InMemoryUserStore(), Clock.systemUTC());

    HealthCheck.Result result = new AuthCoreHealthCheck(issuer, hasher).execute();

    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getMessage()).isEqualTo("access token ttl=900s");
  }

  @Test
  void execute_tokenDoesNotVerify_isUnhealthy() {
    TokenIssuer issuer = mock(TokenIssuer.class);
    when(issuer.mint(AuthCoreHealthCheck.HEALTH_SUBJECT)).thenReturn(new TokenPair("a", "r", 900));
    when(issuer.verify(anyString(), eq(TokenType.ACCESS)))
        .thenReturn(AuthResult.failure(AuthError.TOKEN_MALFORMED));

    HealthCheck.Result result = new AuthCoreHealthCheck(issuer, hasher).execute();

    assertThat(result.isHealthy()).isFalse();
    assertThat(result.getMessage()).contains("Signing key");
  }

  @Test
  void execute_hasherBroken_isUnhealthy() {
    TokenIssuer issuer = new TokenIssuer(
        new TokenSettings(SECRET, "cgraph-test", TokenSettings.DEFAULT_ACCESS_TTL,
            TokenSettings.DEFAULT_REFRESH_TTL, TokenSettings.DEFAULT_SECOND_FACTOR_TTL),
        new InMemoryRefreshTokenDenylist(), new InMemoryUserStore(), Clock.systemUTC());
    Argon2PasswordHasher broken = mock(Argon2PasswordHasher.class);
    when(broken.selfTest()).thenReturn(false);

    HealthCheck.Result result = new AuthCoreHealthCheck(issuer, broken).execute();

    assertThat(result.isHealthy()).isFalse();
    assertThat(result.getMessage()).contains("Argon2");
  }
}
