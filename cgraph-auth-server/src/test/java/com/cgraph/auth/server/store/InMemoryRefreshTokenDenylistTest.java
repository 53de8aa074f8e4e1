package com.cgraph.auth.server.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class InMemoryRefreshTokenDenylistTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  @Test
  void markUsed_secondTimeFails() {
    InMemoryRefreshTokenDenylist denylist = new InMemoryRefreshTokenDenylist();
    assertThat(denylist.markUsed("jti-1", NOW.plusSeconds(60), NOW)).isTrue();
    assertThat(denylist.markUsed("jti-1", NOW.plusSeconds(60), NOW)).isFalse();
    assertThat(denylist.markUsed("jti-2", NOW.plusSeconds(60), NOW)).isTrue();
  }

  @Test
  void markUsed_purgesExpiredEntriesPeriodically() {
    InMemoryRefreshTokenDenylist denylist = new InMemoryRefreshTokenDenylist();
    denylist.markUsed("old", NOW.minusSeconds(1), NOW);
    for (int i = 0; i < 1100; i++) {
      denylist.markUsed("jti-" + i, NOW.plusSeconds(3600), NOW);
    }
    assertThat(denylist.size()).isEqualTo(1100);
  }
}
