package com.cgraph.auth.server.breach;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.cgraph.auth.server.MutableClock;
import com.cgraph.auth.server.result.AuthError;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BreachCheckServiceTest {

  private static final String PASSWORD = "password";
  private static final String PASSWORD_SHA1 = "5BAA61E4C9B93F3F0682250B6CF8331B7EE68FD8";

  @Mock private PasswordBreachChecker checker;
  private MutableClock clock;
  private BreachCheckService service;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
    service = new BreachCheckService(checker, true, Runnable::run, clock, Duration.ofHours(1),
        Duration.ofMinutes(10));
  }

  @Test
  void sha1Hex_isUpperCaseHex() {
    assertThat(BreachCheckService.sha1Hex(PASSWORD)).isEqualTo(PASSWORD_SHA1);
  }

  @Test
  void check_cachesWithinTtl() {
    when(checker.check(PASSWORD_SHA1)).thenReturn(BreachStatus.found(42));

    assertThat(service.check(PASSWORD)).isEqualTo(BreachStatus.found(42));
    clock.advance(Duration.ofMinutes(59));
    assertThat(service.check(PASSWORD)).isEqualTo(BreachStatus.found(42));
    verify(checker, times(1)).check(PASSWORD_SHA1);

    clock.advance(Duration.ofMinutes(2));
    service.check(PASSWORD);
    verify(checker, times(2)).check(PASSWORD_SHA1);
  }

  @Test
  void check_serviceUnavailable_isClean() {
    when(checker.check(anyString())).thenThrow(new BreachCheckException("down", null));

    assertThat(service.check(PASSWORD)).isEqualTo(BreachStatus.CLEAN);
  }

  @Test
  void check_disabled_neverCallsOut() {
    BreachCheckService disabled = new BreachCheckService(checker, false, Runnable::run, clock,
        Duration.ofHours(1), Duration.ofMinutes(10));

    assertThat(disabled.check(PASSWORD)).isEqualTo(BreachStatus.CLEAN);
    disabled.checkInBackground("u1", PASSWORD);
    verify(checker, never()).check(anyString());
  }

  @Test
  void checkInBackground_runsOnExecutor() {
    when(checker.check(PASSWORD_SHA1)).thenReturn(BreachStatus.found(3));

    service.checkInBackground("u1", PASSWORD);

    verify(checker).check(PASSWORD_SHA1);
  }

  @Test
  void checkInBackground_rejectedExecution_isSwallowedWithWarning() {
    BreachCheckService saturated = new BreachCheckService(checker, true, task -> {
      throw new RejectedExecutionException("full");
    }, clock, Duration.ofHours(1), Duration.ofMinutes(10));

    saturated.checkInBackground("u1", PASSWORD);

    verify(checker, never()).check(anyString());
  }

  @Test
  void checkExposure_limitedPerUserPerWindow() {
    when(checker.check(PASSWORD_SHA1)).thenReturn(BreachStatus.CLEAN);

    assertThat(service.checkExposure("u1", PASSWORD).get()).isEqualTo(BreachStatus.CLEAN);
    assertThat(service.checkExposure("u1", PASSWORD).getError()).isEqualTo(AuthError.RATE_LIMITED);
    assertThat(service.checkExposure("u2", PASSWORD).isSuccess()).isTrue();

    clock.advance(Duration.ofMinutes(10));
    assertThat(service.checkExposure("u1", PASSWORD).isSuccess()).isTrue();
  }

  @Test
  void check_expiredLookupsAreEvicted() {
    when(checker.check(anyString())).thenReturn(BreachStatus.CLEAN);

    for (int i = 0; i < 500; i++) {
      clock.advance(Duration.ofMinutes(61));
      service.check("password-" + i);
    }

    assertThat(service.cachedLookups()).isLessThanOrEqualTo(1);
  }
}
