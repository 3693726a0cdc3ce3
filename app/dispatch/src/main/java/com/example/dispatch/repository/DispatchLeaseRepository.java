/*
 * Where: Dispatch data access
 * What: Time-bounded leases on dispatch keys
 * Why: Only one worker at a time may call the gateway for a (request, channel, address)
 */
package com.example.dispatch.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DispatchLeaseRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Acquires the lease when it is absent, expired, or already held by {@code holder}. */
  public boolean tryAcquire(String leaseKey, String holder, Instant now, Instant leaseUntil) {
    final String sql =
        """
        INSERT INTO dispatch_leases (lease_key, holder, lease_until)
        VALUES (:leaseKey, :holder, :leaseUntil)
        ON CONFLICT (lease_key) DO UPDATE
          SET holder = EXCLUDED.holder,
              lease_until = EXCLUDED.lease_until
        WHERE dispatch_leases.lease_until <= :now
           OR dispatch_leases.holder = EXCLUDED.holder
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("leaseKey", leaseKey)
            .addValue("holder", holder)
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public int release(String leaseKey, String holder) {
    final String sql =
        """
        DELETE FROM dispatch_leases
        WHERE lease_key = :leaseKey
          AND holder = :holder
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("leaseKey", leaseKey).addValue("holder", holder);
    return jdbcTemplate.update(sql, params);
  }

  public boolean isHeld(String leaseKey, Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM dispatch_leases
        WHERE lease_key = :leaseKey
          AND lease_until > :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("leaseKey", leaseKey).addValue("now", toTimestamp(now));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count != null && count > 0;
  }

  public int deleteExpired(Instant now) {
    final String sql = "DELETE FROM dispatch_leases WHERE lease_until <= :now";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)));
  }
}
