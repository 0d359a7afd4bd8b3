/*
 * Where: pipeline data access
 * What: per-recipient quiet hours and per-trigger channel switches
 * Why: a missing row means the recipient kept the defaults, so reads fall back instead of failing
 */
package com.example.matrimony.pipeline.repository;

import static com.example.matrimony.common.JdbcTimestampUtils.toTimestamp;

import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.QuietHoursWindow;
import java.sql.Time;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationPreferenceRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<QuietHoursWindow> findQuietHours(String recipient) {
    final String sql =
        """
        SELECT quiet_hours_enabled, quiet_start, quiet_end, time_zone
        FROM notification_preferences
        WHERE recipient = :recipient
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("recipient", recipient);
    final List<QuietHoursWindow> rows =
        jdbcTemplate.query(
            sql,
            params,
            (rs, rowNum) ->
                new QuietHoursWindow(
                    rs.getBoolean("quiet_hours_enabled"),
                    rs.getTime("quiet_start").toLocalTime(),
                    rs.getTime("quiet_end").toLocalTime(),
                    ZoneId.of(rs.getString("time_zone"))));
    return rows.stream().findFirst();
  }

  public void saveQuietHours(String recipient, QuietHoursWindow window, Instant now) {
    final String sql =
        """
        INSERT INTO notification_preferences (
          recipient, quiet_hours_enabled, quiet_start, quiet_end, time_zone, updated_at
        ) VALUES (
          :recipient, :enabled, :start, :end, :zone, :now
        )
        ON CONFLICT (recipient) DO UPDATE
        SET quiet_hours_enabled = EXCLUDED.quiet_hours_enabled,
            quiet_start = EXCLUDED.quiet_start,
            quiet_end = EXCLUDED.quiet_end,
            time_zone = EXCLUDED.time_zone,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipient", recipient)
            .addValue("enabled", window.enabled())
            .addValue("start", Time.valueOf(window.start()))
            .addValue("end", Time.valueOf(window.end()))
            .addValue("zone", window.zone().getId())
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  /** Channels are on unless the recipient explicitly switched them off for the trigger. */
  public boolean isChannelEnabled(String recipient, String trigger, NotificationChannel channel) {
    final String sql =
        """
        SELECT enabled
        FROM notification_channel_preferences
        WHERE recipient = :recipient
          AND trigger = :trigger
          AND channel = :channel
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipient", recipient)
            .addValue("trigger", trigger)
            .addValue("channel", channel.value());
    final List<Boolean> rows = jdbcTemplate.queryForList(sql, params, Boolean.class);
    return rows.isEmpty() || Boolean.TRUE.equals(rows.get(0));
  }

  public void setChannelEnabled(
      String recipient, String trigger, NotificationChannel channel, boolean enabled, Instant now) {
    final String sql =
        """
        INSERT INTO notification_channel_preferences (recipient, trigger, channel, enabled, updated_at)
        VALUES (:recipient, :trigger, :channel, :enabled, :now)
        ON CONFLICT (recipient, trigger, channel) DO UPDATE
        SET enabled = EXCLUDED.enabled,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipient", recipient)
            .addValue("trigger", trigger)
            .addValue("channel", channel.value())
            .addValue("enabled", enabled)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }
}
