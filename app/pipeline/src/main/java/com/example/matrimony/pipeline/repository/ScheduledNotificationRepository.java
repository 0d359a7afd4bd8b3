/*
 * Where: pipeline data access
 * What: reads enabled scheduled notifications and advances their last_sent_at
 */
package com.example.matrimony.pipeline.repository;

import static com.example.matrimony.common.JdbcTimestampUtils.toInstant;
import static com.example.matrimony.common.JdbcTimestampUtils.toTimestamp;

import com.example.matrimony.pipeline.model.AdminOverride;
import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.RecipientScope;
import com.example.matrimony.pipeline.model.Recurrence;
import com.example.matrimony.pipeline.model.ScheduledNotification;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Time;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ScheduledNotificationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(ScheduledNotification schedule) {
    final String sql =
        """
        INSERT INTO scheduled_notifications (
          schedule_id, owner, trigger, channel, recipient_scope, max_recipients,
          frequency, day_of_week, time_of_day, schedule_zone, template_data_json, enabled,
          last_sent_at, override_frequency, override_day_of_week, override_time_of_day,
          override_zone, override_disabled, override_reason, overridden_by, overridden_at,
          created_at
        ) VALUES (
          :scheduleId, :owner, :trigger, :channel, :recipientScope, :maxRecipients,
          :frequency, :dayOfWeek, :timeOfDay, :zone, :templateDataJson::jsonb, :enabled,
          :lastSentAt, :overrideFrequency, :overrideDayOfWeek, :overrideTimeOfDay,
          :overrideZone, :overrideDisabled, :overrideReason, :overriddenBy, :overriddenAt,
          :createdAt
        )
        """;
    final Recurrence recurrence = schedule.recurrence();
    final AdminOverride override = schedule.adminOverride();
    final Recurrence overrideRecurrence = override == null ? null : override.recurrence();
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("scheduleId", schedule.scheduleId())
            .addValue("owner", schedule.owner())
            .addValue("trigger", schedule.trigger())
            .addValue("channel", schedule.channel().value())
            .addValue("recipientScope", schedule.recipientScope().name())
            .addValue("maxRecipients", schedule.maxRecipients())
            .addValue("frequency", recurrence.frequency().name())
            .addValue("dayOfWeek", dayName(recurrence.dayOfWeek()))
            .addValue("timeOfDay", Time.valueOf(recurrence.timeOfDay()))
            .addValue("zone", recurrence.zone().getId())
            .addValue("templateDataJson", schedule.templateDataJson())
            .addValue("enabled", schedule.enabled())
            .addValue("lastSentAt", toTimestamp(schedule.lastSentAt()))
            .addValue(
                "overrideFrequency",
                overrideRecurrence == null ? null : overrideRecurrence.frequency().name())
            .addValue(
                "overrideDayOfWeek",
                overrideRecurrence == null ? null : dayName(overrideRecurrence.dayOfWeek()))
            .addValue(
                "overrideTimeOfDay",
                overrideRecurrence == null ? null : Time.valueOf(overrideRecurrence.timeOfDay()))
            .addValue(
                "overrideZone", overrideRecurrence == null ? null : overrideRecurrence.zone().getId())
            .addValue("overrideDisabled", override != null && override.disabled())
            .addValue("overrideReason", override == null ? null : override.reason())
            .addValue("overriddenBy", override == null ? null : override.overriddenBy())
            .addValue("overriddenAt", override == null ? null : toTimestamp(override.overriddenAt()))
            .addValue("createdAt", toTimestamp(schedule.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  /**
   * One page of enabled schedules ordered by id, starting after {@code afterScheduleId} (or from
   * the beginning when it is {@code null}). Schedules silenced by an admin override are excluded.
   */
  public List<ScheduledNotification> findEnabledPage(UUID afterScheduleId, int pageSize) {
    // keyset on the immutable id so marking rows sent mid-scan cannot reorder later pages
    final String keyset = afterScheduleId == null ? "" : "AND schedule_id > :afterScheduleId";
    final String sql =
        """
        SELECT schedule_id, owner, trigger, channel, recipient_scope, max_recipients,
               frequency, day_of_week, time_of_day, schedule_zone,
               template_data_json::text AS template_data_json_text, enabled, last_sent_at,
               override_frequency, override_day_of_week, override_time_of_day, override_zone,
               override_disabled, override_reason, overridden_by, overridden_at, created_at
        FROM scheduled_notifications
        WHERE enabled = TRUE
          AND override_disabled = FALSE
          %s
        ORDER BY schedule_id
        LIMIT :limit
        """
            .formatted(keyset);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("afterScheduleId", afterScheduleId)
            .addValue("limit", pageSize);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markSent(UUID scheduleId, Instant sentAt) {
    final String sql =
        """
        UPDATE scheduled_notifications
        SET last_sent_at = :sentAt
        WHERE schedule_id = :scheduleId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("scheduleId", scheduleId);
    return jdbcTemplate.update(sql, params);
  }

  private String dayName(DayOfWeek dayOfWeek) {
    return dayOfWeek == null ? null : dayOfWeek.name();
  }

  private ScheduledNotification mapRow(ResultSet rs, int rowNum) throws SQLException {
    final Recurrence recurrence =
        new Recurrence(
            Recurrence.Frequency.valueOf(rs.getString("frequency")),
            parseDay(rs.getString("day_of_week")),
            toLocalTime(rs.getTime("time_of_day")),
            ZoneId.of(rs.getString("schedule_zone")));
    final int maxRecipients = rs.getInt("max_recipients");
    final Integer recipientLimit = rs.wasNull() ? null : maxRecipients;
    return new ScheduledNotification(
        UUID.fromString(rs.getString("schedule_id")),
        rs.getString("owner"),
        rs.getString("trigger"),
        NotificationChannel.fromValue(rs.getString("channel")),
        RecipientScope.valueOf(rs.getString("recipient_scope")),
        recipientLimit,
        recurrence,
        rs.getString("template_data_json_text"),
        rs.getBoolean("enabled"),
        toInstant(rs.getTimestamp("last_sent_at")),
        mapOverride(rs),
        toInstant(rs.getTimestamp("created_at")));
  }

  private AdminOverride mapOverride(ResultSet rs) throws SQLException {
    final String frequency = rs.getString("override_frequency");
    final boolean disabled = rs.getBoolean("override_disabled");
    if (frequency == null && !disabled) {
      return null;
    }
    final String zone = rs.getString("override_zone");
    final Recurrence recurrence =
        frequency == null
            ? null
            : new Recurrence(
                Recurrence.Frequency.valueOf(frequency),
                parseDay(rs.getString("override_day_of_week")),
                toLocalTime(rs.getTime("override_time_of_day")),
                zone == null ? ZoneId.of(rs.getString("schedule_zone")) : ZoneId.of(zone));
    return new AdminOverride(
        recurrence,
        disabled,
        rs.getString("override_reason"),
        rs.getString("overridden_by"),
        toInstant(rs.getTimestamp("overridden_at")));
  }

  private DayOfWeek parseDay(String value) {
    return value == null ? null : DayOfWeek.valueOf(value);
  }

  private LocalTime toLocalTime(Time time) {
    return time == null ? null : time.toLocalTime();
  }
}
