/*
 * Where: pipeline data access
 * What: notification_queue insert, pending reads and guarded state transitions
 * Why: every transition is conditional on PENDING so SENT and FAILED rows stay immutable
 */
package com.example.matrimony.pipeline.repository;

import static com.example.matrimony.common.JdbcTimestampUtils.toInstant;
import static com.example.matrimony.common.JdbcTimestampUtils.toTimestamp;

import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.NotificationRecord;
import com.example.matrimony.pipeline.model.NotificationStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationQueueRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT notification_id, recipient, channel, trigger,
             template_data_json::text AS template_data_json_text, status,
             attempts, max_attempts, last_error, created_at, updated_at, sent_at, scheduled_for
      FROM notification_queue
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notification_queue (
          notification_id,
          recipient,
          channel,
          trigger,
          template_data_json,
          status,
          attempts,
          max_attempts,
          last_error,
          created_at,
          updated_at,
          sent_at,
          scheduled_for
        ) VALUES (
          :notificationId,
          :recipient,
          :channel,
          :trigger,
          :templateDataJson::jsonb,
          :status,
          :attempts,
          :maxAttempts,
          :lastError,
          :createdAt,
          :updatedAt,
          :sentAt,
          :scheduledFor
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("recipient", record.recipient())
            .addValue("channel", record.channel().value())
            .addValue("trigger", record.trigger())
            .addValue("templateDataJson", record.templateDataJson())
            .addValue("status", record.status().name())
            .addValue("attempts", record.attempts())
            .addValue("maxAttempts", record.maxAttempts())
            .addValue("lastError", record.lastError())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()))
            .addValue("sentAt", toTimestamp(record.sentAt()))
            .addValue("scheduledFor", toTimestamp(record.scheduledFor()));
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  /** Oldest pending records of the channel, leaving out those deferred past {@code now}. */
  public List<NotificationRecord> findPending(NotificationChannel channel, int limit, Instant now) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE status = 'PENDING'
              AND channel = :channel
              AND (scheduled_for IS NULL OR scheduled_for <= :now)
            ORDER BY created_at, notification_id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("channel", channel.value())
            .addValue("now", toTimestamp(now))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<NotificationRecord> findByRecipient(String recipient) {
    final String sql = SELECT_COLUMNS + "WHERE recipient = :recipient ORDER BY created_at DESC";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("recipient", recipient);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markSent(UUID notificationId, Instant sentAt) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'SENT',
            attempts = LEAST(attempts + 1, max_attempts),
            last_error = NULL,
            sent_at = :sentAt,
            updated_at = :sentAt
        WHERE notification_id = :notificationId
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  /**
   * Records one failed attempt. The row turns FAILED once attempts reach max_attempts and stays
   * PENDING otherwise; returns the row as it is after the update, or {@code null} when it was no
   * longer PENDING.
   */
  public NotificationRecord markAttemptFailed(UUID notificationId, String lastError, Instant now) {
    final String sql =
        """
        UPDATE notification_queue
        SET attempts = attempts + 1,
            status = CASE WHEN attempts + 1 >= max_attempts THEN 'FAILED' ELSE 'PENDING' END,
            last_error = :lastError,
            updated_at = :now
        WHERE notification_id = :notificationId
          AND status = 'PENDING'
          AND attempts < max_attempts
        RETURNING notification_id, recipient, channel, trigger,
                  template_data_json::text AS template_data_json_text, status,
                  attempts, max_attempts, last_error, created_at, updated_at, sent_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("lastError", lastError)
            .addValue("now", toTimestamp(now))
            .addValue("notificationId", notificationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst().orElse(null);
  }

  /** Terminal failure without retry; configuration errors and authoritative provider rejections. */
  public int markFailed(UUID notificationId, String lastError, Instant now) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'FAILED',
            attempts = LEAST(attempts + 1, max_attempts),
            last_error = :lastError,
            updated_at = :now
        WHERE notification_id = :notificationId
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("lastError", lastError)
            .addValue("now", toTimestamp(now))
            .addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  public int countPending(NotificationChannel channel) {
    final String sql =
        "SELECT COUNT(*) FROM notification_queue WHERE status = 'PENDING' AND channel = :channel";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("channel", channel.value());
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        UUID.fromString(rs.getString("notification_id")),
        rs.getString("recipient"),
        NotificationChannel.fromValue(rs.getString("channel")),
        rs.getString("trigger"),
        rs.getString("template_data_json_text"),
        NotificationStatus.valueOf(rs.getString("status")),
        rs.getInt("attempts"),
        rs.getInt("max_attempts"),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")),
        toInstant(rs.getTimestamp("sent_at")),
        toInstant(rs.getTimestamp("scheduled_for")));
  }
}
