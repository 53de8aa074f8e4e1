package com.cgraph.auth.server.manager;

import static org.assertj.core.api.Assertions.assertThat;

import com.cgraph.auth.server.AuthFixture;
import com.cgraph.auth.server.result.AuthError;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AccountLifecycleManagerTest {

  private static final String EMAIL = "ada@example.com";
  private static final String PASSWORD = "correct horse";

  private AuthFixture fixture;
  private AuthenticationService service;
  private AccountLifecycleManager lifecycle;

  @BeforeEach
  void setUp() {
    fixture = new AuthFixture();
    service = fixture.authenticationService;
    lifecycle = fixture.lifecycleManager;
  }

  private LoginOutcome.Authenticated login() {
    return (LoginOutcome.Authenticated) service.login(new Credential.Password(EMAIL, PASSWORD),
        SessionContext.UNKNOWN).get();
  }

  @Test
  void ban_revokesEverythingAndBlocksLogin() {
    LoginOutcome.Authenticated registered = service.register(EMAIL, null, PASSWORD,
        SessionContext.UNKNOWN).get();
    LoginOutcome.Authenticated second = login();
    LoginOutcome.Authenticated third = login();
    String userId = registered.userId();

    assertThat(lifecycle.ban(userId, null).isSuccess()).isTrue();

    for (LoginOutcome.Authenticated each : new LoginOutcome.Authenticated[]{registered, second, third}) {
      assertThat(service.resolveSession(each.session().rawToken()).getError())
          .isEqualTo(AuthError.SESSION_NOT_FOUND);
      assertThat(service.authenticateAccessToken(each.tokens().accessToken()).getError())
          .isEqualTo(AuthError.TOKEN_REVOKED);
      assertThat(service.refresh(each.tokens().refreshToken()).getError())
          .isEqualTo(AuthError.TOKEN_REVOKED);
    }
    assertThat(service.login(new Credential.Password(EMAIL, PASSWORD), SessionContext.UNKNOWN)
        .getError()).isEqualTo(AuthError.ACCOUNT_DISABLED);
  }

  @Test
  void ban_temporary_liftsItselfWhenItEnds() {
    String userId = service.register(EMAIL, null, PASSWORD, SessionContext.UNKNOWN).get().userId();
    lifecycle.ban(userId, fixture.clock.instant().plus(Duration.ofHours(1)));

    assertThat(service.login(new Credential.Password(EMAIL, PASSWORD), SessionContext.UNKNOWN)
        .getError()).isEqualTo(AuthError.ACCOUNT_DISABLED);

    fixture.clock.advance(Duration.ofHours(1));
    assertThat(login().userId()).isEqualTo(userId);
  }

  @Test
  void unban_restoresLogin() {
    String userId = service.register(EMAIL, null, PASSWORD, SessionContext.UNKNOWN).get().userId();
    lifecycle.ban(userId, null);

    assertThat(lifecycle.unban(userId).get().bannedAt()).isNull();
    assertThat(login().userId()).isEqualTo(userId);
  }

  @Test
  void unban_doesNotReviveTokensIssuedBeforeTheBan() {
    LoginOutcome.Authenticated registered = service.register(EMAIL, null, PASSWORD,
        SessionContext.UNKNOWN).get();
    fixture.clock.advance(Duration.ofSeconds(1));
    lifecycle.ban(registered.userId(), null);
    lifecycle.unban(registered.userId());

    assertThat(service.authenticateAccessToken(registered.tokens().accessToken()).getError())
        .isEqualTo(AuthError.TOKEN_REVOKED);
    assertThat(service.refresh(registered.tokens().refreshToken()).getError())
        .isEqualTo(AuthError.TOKEN_REVOKED);
    LoginOutcome.Authenticated fresh = login();
    assertThat(service.authenticateAccessToken(fresh.tokens().accessToken()).get().id())
        .isEqualTo(registered.userId());
  }

  @Test
  void deactivate_keepsRecordButBlocksEverything() {
    LoginOutcome.Authenticated registered = service.register(EMAIL, null, PASSWORD,
        SessionContext.UNKNOWN).get();

    assertThat(lifecycle.deactivate(registered.userId()).get().deletedAt())
        .isEqualTo(fixture.clock.instant());

    assertThat(fixture.userStore.findById(registered.userId())).isPresent();
    assertThat(service.resolveSession(registered.session().rawToken()).isSuccess()).isFalse();
    assertThat(service.login(new Credential.Password(EMAIL, PASSWORD), SessionContext.UNKNOWN)
        .getError()).isEqualTo(AuthError.ACCOUNT_DISABLED);
  }

  @Test
  void unknownUser_isInvalidRequest() {
    assertThat(lifecycle.ban("ghost", null).getError()).isEqualTo(AuthError.INVALID_REQUEST);
    assertThat(lifecycle.unban("ghost").getError()).isEqualTo(AuthError.INVALID_REQUEST);
    assertThat(lifecycle.deactivate("ghost").getError()).isEqualTo(AuthError.INVALID_REQUEST);
  }
}
