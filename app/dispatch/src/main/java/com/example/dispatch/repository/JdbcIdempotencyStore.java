/*
 * Where: Dispatch data access
 * What: idempotency_keys backed reservation of dedup keys
 * Why: A single upsert decides the winner; expired keys can be reserved again
 */
package com.example.dispatch.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dispatch.model.Reservation;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JdbcIdempotencyStore implements IdempotencyStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final Clock clock;

  @Override
  @Transactional(propagation = Propagation.MANDATORY)
  public Reservation reserve(String key, UUID candidateRef, Duration ttl) {
    final Instant now = Instant.now(clock);
    final String sql =
        """
        INSERT INTO idempotency_keys (idem_key, ref_id, expires_at)
        VALUES (:key, :refId, :expiresAt)
        ON CONFLICT (idem_key) DO UPDATE
          SET ref_id = EXCLUDED.ref_id,
              expires_at = EXCLUDED.expires_at
        WHERE idempotency_keys.expires_at <= :now
        RETURNING ref_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("refId", candidateRef)
            .addValue("expiresAt", toTimestamp(now.plus(ttl)))
            .addValue("now", toTimestamp(now));
    final List<UUID> inserted =
        jdbcTemplate.query(sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("ref_id")));
    if (!inserted.isEmpty()) {
      return Reservation.granted();
    }
    // the conflicting row is locked by the upsert, so this read sees the committed holder
    final String select = "SELECT ref_id FROM idempotency_keys WHERE idem_key = :key";
    final UUID existing =
        jdbcTemplate.queryForObject(
            select,
            new MapSqlParameterSource().addValue("key", key),
            (rs, rowNum) -> UUID.fromString(rs.getString("ref_id")));
    return Reservation.existing(existing);
  }

  public int deleteExpired(Instant now) {
    final String sql = "DELETE FROM idempotency_keys WHERE expires_at <= :now";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)));
  }
}
