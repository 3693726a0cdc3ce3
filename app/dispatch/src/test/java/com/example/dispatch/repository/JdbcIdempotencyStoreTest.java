package com.example.dispatch.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.dispatch.AbstractPostgresContainerTest;
import com.example.dispatch.model.Reservation;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@ActiveProfiles("test")
class JdbcIdempotencyStoreTest extends AbstractPostgresContainerTest {

  @Autowired private JdbcIdempotencyStore store;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @Autowired private PlatformTransactionManager transactionManager;

  private TransactionTemplate tx;

  @BeforeEach
  void setUp() {
    truncateAll(jdbcTemplate);
    tx = new TransactionTemplate(transactionManager);
  }

  @Test
  void firstReservationIsGrantedAndSecondSeesHolder() {
    final UUID first = UUID.randomUUID();

    final Reservation granted =
        tx.execute(status -> store.reserve("order-1", first, Duration.ofHours(1)));
    final Reservation existing =
        tx.execute(status -> store.reserve("order-1", UUID.randomUUID(), Duration.ofHours(1)));

    assertThat(granted.acquired()).isTrue();
    assertThat(existing.acquired()).isFalse();
    assertThat(existing.existingRef()).isEqualTo(first);
  }

  @Test
  void expiredReservationIsGrantedAgain() {
    final UUID stale = UUID.randomUUID();
    jdbcTemplate.update(
        "INSERT INTO idempotency_keys (idem_key, ref_id, expires_at) VALUES (:k, :r, :e)",
        new MapSqlParameterSource()
            .addValue("k", "order-2")
            .addValue("r", stale)
            .addValue("e", Timestamp.from(Instant.now().minusSeconds(60))));
    final UUID fresh = UUID.randomUUID();

    final Reservation reservation =
        tx.execute(status -> store.reserve("order-2", fresh, Duration.ofHours(1)));

    assertThat(reservation.acquired()).isTrue();
    final Reservation again =
        tx.execute(status -> store.reserve("order-2", UUID.randomUUID(), Duration.ofHours(1)));
    assertThat(again.existingRef()).isEqualTo(fresh);
  }

  @Test
  void reservationRolledBackWithItsTransaction() {
    tx.execute(
        status -> {
          store.reserve("order-3", UUID.randomUUID(), Duration.ofHours(1));
          status.setRollbackOnly();
          return null;
        });

    final Reservation reservation =
        tx.execute(status -> store.reserve("order-3", UUID.randomUUID(), Duration.ofHours(1)));
    assertThat(reservation.acquired()).isTrue();
  }

  @Test
  void reserveOutsideTransactionIsRejected() {
    assertThatThrownBy(() -> store.reserve("order-4", UUID.randomUUID(), Duration.ofHours(1)))
        .isInstanceOf(IllegalTransactionStateException.class);
  }

  @Test
  void deleteExpiredRemovesOnlyExpiredKeys() {
    tx.execute(status -> store.reserve("live", UUID.randomUUID(), Duration.ofHours(1)));
    tx.execute(status -> store.reserve("short", UUID.randomUUID(), Duration.ofMillis(1)));

    final int deleted = store.deleteExpired(Instant.now().plusSeconds(1));

    assertThat(deleted).isEqualTo(1);
  }
}
