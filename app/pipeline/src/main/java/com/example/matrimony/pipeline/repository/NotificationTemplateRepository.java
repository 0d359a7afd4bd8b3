/*
 * Where: pipeline data access
 * What: lookup of the enabled notification template for a trigger and channel
 */
package com.example.matrimony.pipeline.repository;

import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.NotificationTemplate;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationTemplateRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<NotificationTemplate> findEnabled(String trigger, NotificationChannel channel) {
    final String sql =
        """
        SELECT trigger, channel, subject, body, max_length, enabled
        FROM notification_templates
        WHERE trigger = :trigger
          AND channel = :channel
          AND enabled = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("trigger", trigger).addValue("channel", channel.value());
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public void upsert(NotificationTemplate template) {
    final String sql =
        """
        INSERT INTO notification_templates (trigger, channel, subject, body, max_length, enabled)
        VALUES (:trigger, :channel, :subject, :body, :maxLength, :enabled)
        ON CONFLICT (trigger, channel) DO UPDATE
        SET subject = EXCLUDED.subject,
            body = EXCLUDED.body,
            max_length = EXCLUDED.max_length,
            enabled = EXCLUDED.enabled
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("trigger", template.trigger())
            .addValue("channel", template.channel().value())
            .addValue("subject", template.subject())
            .addValue("body", template.body())
            .addValue("maxLength", template.maxLength())
            .addValue("enabled", template.enabled());
    jdbcTemplate.update(sql, params);
  }

  private NotificationTemplate mapRow(ResultSet rs, int rowNum) throws SQLException {
    final int maxLength = rs.getInt("max_length");
    final Integer limit = rs.wasNull() ? null : maxLength;
    return new NotificationTemplate(
        rs.getString("trigger"),
        NotificationChannel.fromValue(rs.getString("channel")),
        rs.getString("subject"),
        rs.getString("body"),
        limit,
        rs.getBoolean("enabled"));
  }
}
