/*
 * Where: Dispatch data access
 * What: sent_notification_logs and their append-only delivery_attempts
 * Why: The unique (request, channel, address) key keeps one log per dispatch target
 */
package com.example.dispatch.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dispatch.model.AttemptStatus;
import com.example.dispatch.model.Channel;
import com.example.dispatch.model.DeliveryAttempt;
import com.example.dispatch.model.DeliveryStatus;
import com.example.dispatch.model.SentNotificationLog;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SentNotificationLogRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT log_id, request_id, notification_type, recipient_id, channel, address, subject, body,
             status, attempt_count, next_retry_at, provider_message_id, last_failure_reason,
             created_at, updated_at
      FROM sent_notification_logs
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Inserts the log unless one already exists for its dispatch key. Returns rows inserted. */
  public int insertIfAbsent(SentNotificationLog log) {
    final String sql =
        """
        INSERT INTO sent_notification_logs (
          log_id,
          request_id,
          notification_type,
          recipient_id,
          channel,
          address,
          subject,
          body,
          status,
          attempt_count,
          next_retry_at,
          provider_message_id,
          last_failure_reason,
          created_at,
          updated_at
        ) VALUES (
          :logId,
          :requestId,
          :notificationType,
          :recipientId,
          :channel,
          :address,
          :subject,
          :body,
          :status,
          :attemptCount,
          :nextRetryAt,
          :providerMessageId,
          :lastFailureReason,
          :createdAt,
          :updatedAt
        )
        ON CONFLICT (request_id, channel, address) DO NOTHING
        """;
    final MapSqlParameterSource params =
        stateParams(log)
            .addValue("requestId", log.requestId())
            .addValue("notificationType", log.notificationType())
            .addValue("recipientId", log.recipientId())
            .addValue("channel", log.channel().name())
            .addValue("address", log.address())
            .addValue("subject", log.subject())
            .addValue("body", log.body())
            .addValue("createdAt", toTimestamp(log.createdAt()));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * Compare-and-set on (status, attempt count): two writers cannot both record the same attempt.
   * Returns rows updated.
   */
  public int update(
      SentNotificationLog next, DeliveryStatus expectedStatus, int expectedAttemptCount) {
    final String sql =
        """
        UPDATE sent_notification_logs
        SET status = :status,
            attempt_count = :attemptCount,
            next_retry_at = :nextRetryAt,
            provider_message_id = :providerMessageId,
            last_failure_reason = :lastFailureReason,
            updated_at = :updatedAt
        WHERE log_id = :logId
          AND status = :expectedStatus
          AND attempt_count = :expectedAttemptCount
        """;
    final MapSqlParameterSource params =
        stateParams(next)
            .addValue("expectedStatus", expectedStatus.name())
            .addValue("expectedAttemptCount", expectedAttemptCount);
    return jdbcTemplate.update(sql, params);
  }

  public void insertAttempt(DeliveryAttempt attempt) {
    final String sql =
        """
        INSERT INTO delivery_attempts (log_id, attempt_number, attempted_at, status, failure_reason)
        VALUES (:logId, :attemptNumber, :attemptedAt, :status, :failureReason)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("logId", attempt.logId())
            .addValue("attemptNumber", attempt.attemptNumber())
            .addValue("attemptedAt", toTimestamp(attempt.attemptedAt()))
            .addValue("status", attempt.status().name())
            .addValue("failureReason", attempt.failureReason());
    jdbcTemplate.update(sql, params);
  }

  public Optional<SentNotificationLog> findById(UUID logId) {
    final String sql = SELECT_COLUMNS + " WHERE log_id = :logId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("logId", logId), this::mapRow)
        .stream()
        .findFirst();
  }

  public Optional<SentNotificationLog> findByDispatchKey(
      UUID requestId, Channel channel, String address) {
    final String sql =
        SELECT_COLUMNS
            + " WHERE request_id = :requestId AND channel = :channel AND address = :address";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", requestId)
            .addValue("channel", channel.name())
            .addValue("address", address);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<SentNotificationLog> findByRequestId(UUID requestId) {
    final String sql = SELECT_COLUMNS + " WHERE request_id = :requestId ORDER BY created_at, log_id";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("requestId", requestId), this::mapRow);
  }

  public List<SentNotificationLog> findByAddress(String address, int limit) {
    final String sql =
        SELECT_COLUMNS + " WHERE address = :address ORDER BY created_at DESC LIMIT :limit";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("address", address).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<SentNotificationLog> findFailedUpdatedBefore(Instant threshold, int limit) {
    final String sql =
        SELECT_COLUMNS
            + """
             WHERE status = 'FAILED'
               AND updated_at <= :threshold
             ORDER BY updated_at
             LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Queued logs whose first attempt or retry is due. */
  public List<SentNotificationLog> findDueForRetry(Instant now, int limit) {
    final String sql =
        SELECT_COLUMNS
            + """
             WHERE status = 'QUEUED_FOR_DISPATCH'
               AND next_retry_at <= :now
             ORDER BY next_retry_at
             LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<DeliveryAttempt> findAttemptsByRequestId(UUID requestId) {
    final String sql =
        """
        SELECT a.log_id, a.attempt_number, a.attempted_at, a.status, a.failure_reason
        FROM delivery_attempts a
        JOIN sent_notification_logs l ON l.log_id = a.log_id
        WHERE l.request_id = :requestId
        ORDER BY a.attempted_at, a.attempt_number
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("requestId", requestId), this::mapAttempt);
  }

  public List<DeliveryAttempt> findAttempts(UUID logId) {
    final String sql =
        """
        SELECT log_id, attempt_number, attempted_at, status, failure_reason
        FROM delivery_attempts
        WHERE log_id = :logId
        ORDER BY attempt_number
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("logId", logId), this::mapAttempt);
  }

  /**
   * Notifications of {@code type} successfully sent to {@code recipientId} inside [from, to]. A
   * request that reached the recipient on several channels counts once.
   */
  public long countSuccessfulSends(String recipientId, String type, Instant from, Instant to) {
    final String sql =
        """
        SELECT COUNT(DISTINCT l.request_id)
        FROM delivery_attempts a
        JOIN sent_notification_logs l ON l.log_id = a.log_id
        WHERE l.recipient_id = :recipientId
          AND l.notification_type = :type
          AND a.status = 'SENT'
          AND a.attempted_at >= :from
          AND a.attempted_at <= :to
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", recipientId)
            .addValue("type", type)
            .addValue("from", toTimestamp(from))
            .addValue("to", toTimestamp(to));
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  private MapSqlParameterSource stateParams(SentNotificationLog log) {
    return new MapSqlParameterSource()
        .addValue("logId", log.logId())
        .addValue("status", log.status().name())
        .addValue("attemptCount", log.attemptCount())
        .addValue("nextRetryAt", toTimestamp(log.nextRetryAt()))
        .addValue("providerMessageId", log.providerMessageId())
        .addValue("lastFailureReason", log.lastFailureReason())
        .addValue("updatedAt", toTimestamp(log.updatedAt()));
  }

  private SentNotificationLog mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SentNotificationLog(
        UUID.fromString(rs.getString("log_id")),
        UUID.fromString(rs.getString("request_id")),
        rs.getString("notification_type"),
        rs.getString("recipient_id"),
        Channel.valueOf(rs.getString("channel")),
        rs.getString("address"),
        rs.getString("subject"),
        rs.getString("body"),
        DeliveryStatus.valueOf(rs.getString("status")),
        rs.getInt("attempt_count"),
        toInstant(rs.getTimestamp("next_retry_at")),
        rs.getString("provider_message_id"),
        rs.getString("last_failure_reason"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private DeliveryAttempt mapAttempt(ResultSet rs, int rowNum) throws SQLException {
    return new DeliveryAttempt(
        UUID.fromString(rs.getString("log_id")),
        rs.getInt("attempt_number"),
        toInstant(rs.getTimestamp("attempted_at")),
        AttemptStatus.valueOf(rs.getString("status")),
        rs.getString("failure_reason"));
  }
}
