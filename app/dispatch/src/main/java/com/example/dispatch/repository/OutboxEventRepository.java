/*
 * Where: Dispatch data access
 * What: outbox_events append, claim and publish bookkeeping
 * Why: Events are written with the state change and published later, at least once
 */
package com.example.dispatch.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dispatch.model.OutboxEventRecord;
import com.example.dispatch.model.OutboxStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class OutboxEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public OutboxEventRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // EI_EXPOSE_REP2: keep our own wrapper instead of the injected reference
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  public int insert(
      UUID eventId, String eventType, String aggregateKey, String payloadJson, Instant createdAt) {
    final String sql =
        """
        INSERT INTO outbox_events (
          event_id,
          event_type,
          aggregate_key,
          payload,
          status,
          attempt_count,
          created_at
        ) VALUES (
          :eventId,
          :eventType,
          :aggregateKey,
          :payload::jsonb,
          'PENDING',
          0,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("eventType", eventType)
            .addValue("aggregateKey", aggregateKey)
            .addValue("payload", payloadJson)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params);
  }

  /** Claims due PENDING rows plus IN_FLIGHT rows whose publisher lease ran out. */
  public List<OutboxEventRecord> claimPending(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        WITH due AS (
          SELECT event_id
          FROM outbox_events
          WHERE (status = 'PENDING' AND (next_retry_at IS NULL OR next_retry_at <= :now))
             OR (status = 'IN_FLIGHT' AND (lease_until IS NULL OR lease_until <= :now))
          ORDER BY created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE outbox_events e
        SET status = 'IN_FLIGHT',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        FROM due
        WHERE e.event_id = due.event_id
        RETURNING e.event_id, e.event_type, e.aggregate_key, e.payload::text AS payload_text,
                  e.attempt_count
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markPublished(UUID eventId, String lockedBy, Instant publishedAt) {
    final String sql =
        """
        UPDATE outbox_events
        SET status = 'PUBLISHED',
            published_at = :publishedAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            last_error = NULL
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("publishedAt", toTimestamp(publishedAt))
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailure(
      UUID eventId,
      String lockedBy,
      int attemptCount,
      OutboxStatus status,
      Instant nextRetryAt,
      String lastError) {
    final String sql =
        """
        UPDATE outbox_events
        SET attempt_count = :attemptCount,
            status = :status,
            next_retry_at = :nextRetryAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            last_error = :lastError
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attemptCount", attemptCount)
            .addValue("status", status.name())
            .addValue("nextRetryAt", toTimestamp(nextRetryAt))
            .addValue("lastError", lastError)
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int countByStatus(OutboxStatus status) {
    final String sql = "SELECT COUNT(*) FROM outbox_events WHERE status = :status";
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("status", status.name()), Integer.class);
    return count == null ? 0 : count;
  }

  public List<String> findEventTypesByAggregateKey(String aggregateKey) {
    final String sql =
        """
        SELECT event_type
        FROM outbox_events
        WHERE aggregate_key = :aggregateKey
        ORDER BY created_at, event_id
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("aggregateKey", aggregateKey),
        (rs, rowNum) -> rs.getString("event_type"));
  }

  private OutboxEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OutboxEventRecord(
        UUID.fromString(rs.getString("event_id")),
        rs.getString("event_type"),
        rs.getString("aggregate_key"),
        rs.getString("payload_text"),
        rs.getInt("attempt_count"));
  }
}
