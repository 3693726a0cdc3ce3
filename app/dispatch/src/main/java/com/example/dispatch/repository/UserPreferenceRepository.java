/*
 * Where: Dispatch data access
 * What: user_notification_preferences rows with versioned upsert
 * Why: Preferences change only through explicit, non-overlapping updates
 */
package com.example.dispatch.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.ChannelOptIn;
import com.example.dispatch.model.DoNotDisturbWindow;
import com.example.dispatch.model.FrequencyLimit;
import com.example.dispatch.model.UserNotificationPreferences;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Time;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserPreferenceRepository {

  private static final TypeReference<List<StoredOptIn>> OPT_INS_TYPE = new TypeReference<>() {};
  private static final TypeReference<List<StoredLimit>> LIMITS_TYPE = new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public Optional<UserNotificationPreferences> findByUserId(String userId) {
    final String sql =
        """
        SELECT user_id, opt_ins::text AS opt_ins_text, dnd_start, dnd_end, dnd_zone,
               frequency_limits::text AS frequency_limits_text, version, updated_at
        FROM user_notification_preferences
        WHERE user_id = :userId
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("userId", userId), this::mapRow)
        .stream()
        .findFirst();
  }

  /**
   * Inserts or replaces the preferences when the stored version equals {@code expectedVersion}
   * (0 for a user without a row).
   *
   * @throws ConcurrencyConflictException when the stored version differs
   */
  public UserNotificationPreferences upsert(
      UserNotificationPreferences preferences, long expectedVersion) {
    final String sql =
        """
        INSERT INTO user_notification_preferences (
          user_id, opt_ins, dnd_start, dnd_end, dnd_zone, frequency_limits, version, updated_at
        ) VALUES (
          :userId, :optIns::jsonb, :dndStart, :dndEnd, :dndZone, :frequencyLimits::jsonb, 1, :updatedAt
        )
        ON CONFLICT (user_id) DO UPDATE
          SET opt_ins = EXCLUDED.opt_ins,
              dnd_start = EXCLUDED.dnd_start,
              dnd_end = EXCLUDED.dnd_end,
              dnd_zone = EXCLUDED.dnd_zone,
              frequency_limits = EXCLUDED.frequency_limits,
              version = user_notification_preferences.version + 1,
              updated_at = EXCLUDED.updated_at
        WHERE user_notification_preferences.version = :expectedVersion
        """;
    final DoNotDisturbWindow dnd = preferences.doNotDisturb();
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", preferences.userId())
            .addValue(
                "optIns",
                writeJson(
                    preferences.optIns().stream()
                        .map(o -> new StoredOptIn(o.type(), o.channel(), o.enabled()))
                        .toList()))
            .addValue("dndStart", dnd == null ? null : Time.valueOf(dnd.start()))
            .addValue("dndEnd", dnd == null ? null : Time.valueOf(dnd.end()))
            .addValue("dndZone", dnd == null ? null : dnd.zone().getId())
            .addValue(
                "frequencyLimits",
                writeJson(
                    preferences.frequencyLimits().stream()
                        .map(l -> new StoredLimit(l.type(), l.maxCount(), l.window().toSeconds()))
                        .toList()))
            .addValue("updatedAt", toTimestamp(preferences.updatedAt()))
            .addValue("expectedVersion", expectedVersion);
    final int updated = jdbcTemplate.update(sql, params);
    if (updated == 0) {
      throw new ConcurrencyConflictException(
          "preferences of user " + preferences.userId() + " were modified concurrently");
    }
    return findByUserId(preferences.userId())
        .orElseThrow(() -> new IllegalStateException("preferences vanished after upsert"));
  }

  private UserNotificationPreferences mapRow(ResultSet rs, int rowNum) throws SQLException {
    final Time dndStart = rs.getTime("dnd_start");
    final Time dndEnd = rs.getTime("dnd_end");
    final String dndZone = rs.getString("dnd_zone");
    final DoNotDisturbWindow dnd =
        dndStart == null || dndEnd == null || dndZone == null
            ? null
            : new DoNotDisturbWindow(dndStart.toLocalTime(), dndEnd.toLocalTime(), ZoneId.of(dndZone));
    final List<ChannelOptIn> optIns =
        readJson(rs.getString("opt_ins_text"), OPT_INS_TYPE).stream()
            .map(o -> new ChannelOptIn(o.type(), o.channel(), o.enabled()))
            .toList();
    final List<FrequencyLimit> limits =
        readJson(rs.getString("frequency_limits_text"), LIMITS_TYPE).stream()
            .map(l -> new FrequencyLimit(l.type(), l.maxCount(), Duration.ofSeconds(l.windowSeconds())))
            .toList();
    return new UserNotificationPreferences(
        rs.getString("user_id"),
        optIns,
        dnd,
        limits,
        rs.getLong("version"),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize preferences column", ex);
    }
  }

  private <T> T readJson(String json, TypeReference<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse preferences column", ex);
    }
  }

  record StoredOptIn(String type, Channel channel, boolean enabled) {}

  record StoredLimit(String type, int maxCount, long windowSeconds) {}
}
