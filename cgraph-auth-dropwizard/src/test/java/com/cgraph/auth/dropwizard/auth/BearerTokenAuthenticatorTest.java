package com.cgraph.auth.dropwizard.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.cgraph.auth.server.manager.AuthenticationService;
import com.cgraph.auth.server.result.AuthError;
import com.cgraph.auth.server.result.AuthResult;
import com.cgraph.auth.server.store.UserRecord;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BearerTokenAuthenticatorTest {

  @Mock private AuthenticationService authenticationService;

  private BearerTokenAuthenticator authenticator;

  @BeforeEach
  void setUp() {
    authenticator = new BearerTokenAuthenticator(authenticationService);
  }

  @Test
  void authenticate_activeUser_returnsPrincipal() throws Exception {
    UserRecord user = UserRecord.withPassword("u1", "ada@example.com", "ada", "hash",
        Instant.parse("2024-05-01T12:00:00Z"));
    when(authenticationService.authenticateAccessToken("good")).thenReturn(AuthResult.success(user));

    Optional<CgraphPrincipal> principal = authenticator.authenticate("good");

    assertThat(principal).contains(new CgraphPrincipal("u1", "ada@example.com", null));
    assertThat(principal.get().getName()).isEqualTo("u1");
  }

  @Test
  void authenticate_rejectedToken_returnsEmpty() throws Exception {
    when(authenticationService.authenticateAccessToken("refresh"))
        .thenReturn(AuthResult.failure(AuthError.TOKEN_WRONG_TYPE));

    assertThat(authenticator.authenticate("refresh")).isEmpty();
  }
}
