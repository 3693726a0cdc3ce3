/*
 * Where: Dispatch data access
 * What: Stores notification request snapshots with optimistic versioning
 * Why: Concurrent process/reconcile/cancel calls must not overwrite each other
 */
package com.example.dispatch.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.NotificationRequest;
import com.example.dispatch.model.Recipient;
import com.example.dispatch.model.RequestStatus;
import com.example.dispatch.model.Urgency;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRequestRepository {

  private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};
  private static final TypeReference<List<Recipient>> RECIPIENTS_TYPE = new TypeReference<>() {};
  private static final TypeReference<List<Channel>> CHANNELS_TYPE = new TypeReference<>() {};
  private static final TypeReference<Map<Channel, UUID>> PINNED_TYPE = new TypeReference<>() {};

  private static final String SELECT_COLUMNS =
      """
      SELECT request_id, type, payload::text AS payload_text, recipients::text AS recipients_text,
             channel_preferences::text AS channel_preferences_text, urgency, scheduled_at,
             correlation_id, dedup_key, status, status_reason,
             pinned_templates::text AS pinned_templates_text, next_evaluation_at, version,
             created_at, updated_at
      FROM notification_requests
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public void insert(NotificationRequest request) {
    final String sql =
        """
        INSERT INTO notification_requests (
          request_id,
          type,
          payload,
          recipients,
          channel_preferences,
          urgency,
          scheduled_at,
          correlation_id,
          dedup_key,
          status,
          status_reason,
          pinned_templates,
          next_evaluation_at,
          version,
          created_at,
          updated_at
        ) VALUES (
          :requestId,
          :type,
          :payload::jsonb,
          :recipients::jsonb,
          :channelPreferences::jsonb,
          :urgency,
          :scheduledAt,
          :correlationId,
          :dedupKey,
          :status,
          :statusReason,
          :pinnedTemplates::jsonb,
          :nextEvaluationAt,
          :version,
          :createdAt,
          :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        stateParams(request)
            .addValue("type", request.type())
            .addValue("payload", writeJson(request.payload()))
            .addValue("channelPreferences", writeJson(request.channelPreferences()))
            .addValue("urgency", request.urgency().name())
            .addValue("scheduledAt", toTimestamp(request.scheduledAt()))
            .addValue("correlationId", request.correlationId())
            .addValue("dedupKey", request.dedupKey())
            .addValue("pinnedTemplates", writeJson(request.pinnedTemplateIds()))
            .addValue("version", request.version())
            .addValue("createdAt", toTimestamp(request.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<NotificationRequest> findById(UUID requestId) {
    final String sql = SELECT_COLUMNS + " WHERE request_id = :requestId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("requestId", requestId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * Writes the mutable part of the snapshot when the stored version still equals {@code
   * expectedVersion}.
   *
   * @return the saved snapshot carrying the incremented version
   * @throws ConcurrencyConflictException when another writer saved first
   */
  public NotificationRequest save(NotificationRequest request, long expectedVersion) {
    final String sql =
        """
        UPDATE notification_requests
        SET status = :status,
            status_reason = :statusReason,
            recipients = :recipients::jsonb,
            next_evaluation_at = :nextEvaluationAt,
            updated_at = :updatedAt,
            version = version + 1
        WHERE request_id = :requestId
          AND version = :expectedVersion
        """;
    final MapSqlParameterSource params =
        stateParams(request).addValue("expectedVersion", expectedVersion);
    final int updated = jdbcTemplate.update(sql, params);
    if (updated == 0) {
      throw new ConcurrencyConflictException(
          "notification request "
              + request.requestId()
              + " was modified concurrently (expected version "
              + expectedVersion
              + ")");
    }
    return new NotificationRequest(
        request.requestId(),
        request.type(),
        request.payload(),
        request.recipients(),
        request.channelPreferences(),
        request.urgency(),
        request.scheduledAt(),
        request.correlationId(),
        request.dedupKey(),
        request.status(),
        request.statusReason(),
        request.pinnedTemplateIds(),
        request.nextEvaluationAt(),
        expectedVersion + 1,
        request.createdAt(),
        request.updatedAt());
  }

  /** PENDING requests whose scheduled or deferred evaluation time has passed, oldest first. */
  public List<UUID> findDueForEvaluation(Instant now, int limit) {
    final String sql =
        """
        SELECT request_id
        FROM notification_requests
        WHERE status = 'PENDING'
          AND next_evaluation_at <= :now
        ORDER BY next_evaluation_at
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("request_id")));
  }

  /** PROCESSING requests untouched since {@code threshold}; reconciled by the sweep. */
  public List<UUID> findProcessingUpdatedBefore(Instant threshold, int limit) {
    final String sql =
        """
        SELECT request_id
        FROM notification_requests
        WHERE status = 'PROCESSING'
          AND updated_at <= :threshold
        ORDER BY updated_at
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("request_id")));
  }

  /**
   * Records that cancellation was asked for a PROCESSING request. Kept outside the versioned
   * state so an in-flight dispatch can read it without contending on the request row version.
   */
  public boolean markCancelRequested(UUID requestId, Instant at) {
    final String sql =
        """
        UPDATE notification_requests
        SET cancel_requested_at = COALESCE(cancel_requested_at, :at)
        WHERE request_id = :requestId
          AND status = 'PROCESSING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("requestId", requestId).addValue("at", toTimestamp(at));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public boolean isCancelRequested(UUID requestId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_requests
        WHERE request_id = :requestId
          AND cancel_requested_at IS NOT NULL
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("requestId", requestId), Integer.class);
    return count != null && count > 0;
  }

  public int countByStatus(RequestStatus status) {
    final String sql = "SELECT COUNT(*) FROM notification_requests WHERE status = :status";
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("status", status.name()), Integer.class);
    return count == null ? 0 : count;
  }

  private MapSqlParameterSource stateParams(NotificationRequest request) {
    return new MapSqlParameterSource()
        .addValue("requestId", request.requestId())
        // enum -> fixed DB string so the CHECK constraint stays authoritative
        .addValue("status", request.status().name())
        .addValue("statusReason", request.statusReason())
        .addValue("recipients", writeJson(request.recipients()))
        .addValue("nextEvaluationAt", toTimestamp(request.nextEvaluationAt()))
        .addValue("updatedAt", toTimestamp(request.updatedAt()));
  }

  private NotificationRequest mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRequest(
        UUID.fromString(rs.getString("request_id")),
        rs.getString("type"),
        readJson(rs.getString("payload_text"), PAYLOAD_TYPE),
        readJson(rs.getString("recipients_text"), RECIPIENTS_TYPE),
        readJson(rs.getString("channel_preferences_text"), CHANNELS_TYPE),
        Urgency.valueOf(rs.getString("urgency")),
        toInstant(rs.getTimestamp("scheduled_at")),
        rs.getString("correlation_id"),
        rs.getString("dedup_key"),
        RequestStatus.valueOf(rs.getString("status")),
        rs.getString("status_reason"),
        readJson(rs.getString("pinned_templates_text"), PINNED_TYPE),
        toInstant(rs.getTimestamp("next_evaluation_at")),
        rs.getLong("version"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize notification request column", ex);
    }
  }

  private <T> T readJson(String json, TypeReference<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse notification request column", ex);
    }
  }
}
