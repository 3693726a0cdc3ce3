package com.example.dispatch.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.dispatch.AbstractPostgresContainerTest;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DispatchLeaseRepositoryTest extends AbstractPostgresContainerTest {

  private static final String KEY = "req:EMAIL:u1@example.com";

  @Autowired private DispatchLeaseRepository leaseRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    truncateAll(jdbcTemplate);
  }

  @Test
  void secondHolderCannotTakeLiveLease() {
    final Instant now = Instant.now();

    assertThat(leaseRepository.tryAcquire(KEY, "host-a", now, now.plusSeconds(30))).isTrue();
    assertThat(leaseRepository.tryAcquire(KEY, "host-b", now, now.plusSeconds(30))).isFalse();
    assertThat(leaseRepository.isHeld(KEY, now)).isTrue();
  }

  @Test
  void expiredLeaseIsTakenOver() {
    final Instant now = Instant.now();
    leaseRepository.tryAcquire(KEY, "host-a", now.minusSeconds(60), now.minusSeconds(30));

    assertThat(leaseRepository.tryAcquire(KEY, "host-b", now, now.plusSeconds(30))).isTrue();
    assertThat(leaseRepository.release(KEY, "host-a")).isZero();
    assertThat(leaseRepository.release(KEY, "host-b")).isEqualTo(1);
    assertThat(leaseRepository.isHeld(KEY, now)).isFalse();
  }

  @Test
  void deleteExpiredKeepsLiveLeases() {
    final Instant now = Instant.now();
    leaseRepository.tryAcquire("expired", "host-a", now.minusSeconds(60), now.minusSeconds(1));
    leaseRepository.tryAcquire("live", "host-a", now, now.plusSeconds(30));

    assertThat(leaseRepository.deleteExpired(now)).isEqualTo(1);
    assertThat(leaseRepository.isHeld("live", now)).isTrue();
  }
}
