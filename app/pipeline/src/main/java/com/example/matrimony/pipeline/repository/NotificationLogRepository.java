/*
 * Where: pipeline data access
 * What: append-only notification_log of terminal delivery outcomes
 * Why: the queue row and its audit entry must be kept apart so cleanup can age them separately
 */
package com.example.matrimony.pipeline.repository;

import java.time.Instant;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.NotificationRecord;
import com.example.matrimony.pipeline.model.NotificationStatus;

import lombok.RequiredArgsConstructor;

import static com.example.matrimony.common.JdbcTimestampUtils.toTimestamp;

@Repository
@RequiredArgsConstructor
public class NotificationLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void append(NotificationRecord record,
      NotificationStatus outcome,
      int attempts,
      String errorMessage,
      Instant createdAt) {
    String sql = """
        INSERT INTO notification_log (
          log_id,
          notification_id,
          recipient,
          channel,
          trigger,
          status,
          attempts,
          error_message,
          created_at
        ) VALUES (
          :logId,
          :notificationId,
          :recipient,
          :channel,
          :trigger,
          :status,
          :attempts,
          :errorMessage,
          :createdAt
        )
        ON CONFLICT (notification_id) DO NOTHING
        """;
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("logId", UUID.randomUUID())
        .addValue("notificationId", record.notificationId())
        .addValue("recipient", record.recipient())
        .addValue("channel", record.channel().value())
        .addValue("trigger", record.trigger())
        .addValue("status", outcome.name())
        .addValue("attempts", attempts)
        .addValue("errorMessage", errorMessage)
        .addValue("createdAt", toTimestamp(createdAt));
    jdbcTemplate.update(sql, params);
  }

  public int countByNotificationId(UUID notificationId) {
    String sql = "SELECT COUNT(*) FROM notification_log WHERE notification_id = :notificationId";
    MapSqlParameterSource params = new MapSqlParameterSource().addValue("notificationId", notificationId);
    Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  /** SENT entries for the recipient on the channel logged at or after {@code since}. */
  public int countSentSince(String recipient, NotificationChannel channel, Instant since) {
    String sql = """
        SELECT COUNT(*)
        FROM notification_log
        WHERE recipient = :recipient
          AND channel = :channel
          AND status = 'SENT'
          AND created_at >= :since
        """;
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("recipient", recipient)
        .addValue("channel", channel.value())
        .addValue("since", toTimestamp(since));
    Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }
}
