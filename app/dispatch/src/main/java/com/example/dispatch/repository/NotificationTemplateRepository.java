/*
 * Where: Dispatch data access
 * What: Versioned notification_templates rows
 * Why: A partial unique index keeps exactly one ACTIVE version per (name, channel)
 */
package com.example.dispatch.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.NotificationTemplate;
import com.example.dispatch.model.TemplateStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class NotificationTemplateRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT template_id, name, channel, subject_template, body_template, version, status, created_at
      FROM notification_templates
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Serializes version allocation for one (name, channel) inside the caller's transaction. */
  @Transactional(propagation = Propagation.MANDATORY)
  public void lockTemplateKey(String name, Channel channel) {
    final String sql = "SELECT pg_advisory_xact_lock(hashtext(:lockKey))";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("lockKey", NotificationTemplate.cacheKey(name, channel));
    jdbcTemplate.query(sql, params, rs -> null);
  }

  public void insert(NotificationTemplate template) {
    final String sql =
        """
        INSERT INTO notification_templates (
          template_id,
          name,
          channel,
          subject_template,
          body_template,
          version,
          status,
          created_at
        ) VALUES (
          :templateId,
          :name,
          :channel,
          :subjectTemplate,
          :bodyTemplate,
          :version,
          :status,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("templateId", template.templateId())
            .addValue("name", template.name())
            .addValue("channel", template.channel().name())
            .addValue("subjectTemplate", template.subjectTemplate())
            .addValue("bodyTemplate", template.bodyTemplate())
            .addValue("version", template.version())
            .addValue("status", template.status().name())
            .addValue("createdAt", toTimestamp(template.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<NotificationTemplate> findById(UUID templateId) {
    final String sql = SELECT_COLUMNS + " WHERE template_id = :templateId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("templateId", templateId), this::mapRow)
        .stream()
        .findFirst();
  }

  public Optional<NotificationTemplate> findActive(String name, Channel channel) {
    final String sql =
        SELECT_COLUMNS + " WHERE name = :name AND channel = :channel AND status = 'ACTIVE'";
    return jdbcTemplate.query(sql, keyParams(name, channel), this::mapRow).stream().findFirst();
  }

  public List<NotificationTemplate> findVersions(String name, Channel channel) {
    final String sql =
        SELECT_COLUMNS + " WHERE name = :name AND channel = :channel ORDER BY version";
    return jdbcTemplate.query(sql, keyParams(name, channel), this::mapRow);
  }

  public int findMaxVersion(String name, Channel channel) {
    final String sql =
        """
        SELECT COALESCE(MAX(version), 0)
        FROM notification_templates
        WHERE name = :name
          AND channel = :channel
        """;
    final Integer max = jdbcTemplate.queryForObject(sql, keyParams(name, channel), Integer.class);
    return max == null ? 0 : max;
  }

  public int deprecateActive(String name, Channel channel) {
    final String sql =
        """
        UPDATE notification_templates
        SET status = 'DEPRECATED'
        WHERE name = :name
          AND channel = :channel
          AND status = 'ACTIVE'
        """;
    return jdbcTemplate.update(sql, keyParams(name, channel));
  }

  /** DRAFT -> ACTIVE. Returns 0 when the version is not a draft. */
  public int activateDraft(UUID templateId) {
    final String sql =
        """
        UPDATE notification_templates
        SET status = 'ACTIVE'
        WHERE template_id = :templateId
          AND status = 'DRAFT'
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("templateId", templateId));
  }

  private MapSqlParameterSource keyParams(String name, Channel channel) {
    return new MapSqlParameterSource().addValue("name", name).addValue("channel", channel.name());
  }

  private NotificationTemplate mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationTemplate(
        UUID.fromString(rs.getString("template_id")),
        rs.getString("name"),
        Channel.valueOf(rs.getString("channel")),
        rs.getString("subject_template"),
        rs.getString("body_template"),
        rs.getInt("version"),
        TemplateStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("created_at")));
  }
}
