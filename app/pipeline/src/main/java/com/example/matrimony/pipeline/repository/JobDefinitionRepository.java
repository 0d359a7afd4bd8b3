/*
 * Where: pipeline data access
 * What: reads due job definitions and writes their post-execution state
 * Why: the scheduler is driven entirely by job_definitions rows
 */
package com.example.matrimony.pipeline.repository;

import static com.example.matrimony.common.JdbcTimestampUtils.toInstant;
import static com.example.matrimony.common.JdbcTimestampUtils.toTimestamp;

import com.example.matrimony.pipeline.model.JobDefinition;
import com.example.matrimony.pipeline.model.JobExecutionStatus;
import com.example.matrimony.pipeline.model.JobSchedule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JobDefinitionRepository {

  private static final TypeReference<Map<String, Object>> PARAMETERS_TYPE = new TypeReference<>() {};

  private static final String SELECT_COLUMNS =
      """
      SELECT name, template_type, schedule_type, interval_seconds, cron_expression, schedule_zone,
             parameters_json::text AS parameters_json_text, enabled, timeout_seconds,
             next_run_at, last_run_at, last_status, created_at, updated_at
      FROM job_definitions
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public void insert(JobDefinition definition) {
    final String sql =
        """
        INSERT INTO job_definitions (
          name,
          template_type,
          schedule_type,
          interval_seconds,
          cron_expression,
          schedule_zone,
          parameters_json,
          enabled,
          timeout_seconds,
          next_run_at,
          created_at,
          updated_at
        ) VALUES (
          :name,
          :templateType,
          :scheduleType,
          :intervalSeconds,
          :cronExpression,
          :scheduleZone,
          :parametersJson::jsonb,
          :enabled,
          :timeoutSeconds,
          :nextRunAt,
          :createdAt,
          :updatedAt
        )
        """;
    final JobSchedule schedule = definition.schedule();
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", definition.name())
            .addValue("templateType", definition.templateType())
            .addValue("scheduleType", schedule.type().name())
            .addValue("intervalSeconds", schedule.intervalSeconds())
            .addValue("cronExpression", schedule.cronExpression())
            .addValue("scheduleZone", schedule.zone().getId())
            .addValue("parametersJson", writeParameters(definition.parameters()))
            .addValue("enabled", definition.enabled())
            .addValue("timeoutSeconds", definition.timeoutSeconds())
            .addValue("nextRunAt", toTimestamp(definition.nextRunAt()))
            .addValue("createdAt", toTimestamp(definition.createdAt()))
            .addValue("updatedAt", toTimestamp(definition.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<JobDefinition> findByName(String name) {
    final String sql = SELECT_COLUMNS + "WHERE name = :name";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("name", name);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<JobDefinition> findDue(Instant now) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE enabled = TRUE
              AND next_run_at IS NOT NULL
              AND next_run_at <= :now
            ORDER BY next_run_at, name
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int updateAfterExecution(
      String name, Instant lastRunAt, JobExecutionStatus lastStatus, Instant nextRunAt, Instant now) {
    final String sql =
        """
        UPDATE job_definitions
        SET last_run_at = :lastRunAt,
            last_status = :lastStatus,
            next_run_at = :nextRunAt,
            updated_at = :now
        WHERE name = :name
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("lastRunAt", toTimestamp(lastRunAt))
            .addValue("lastStatus", lastStatus.name())
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private String writeParameters(Map<String, Object> parameters) {
    try {
      return objectMapper.writeValueAsString(parameters);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("job parameters are not serializable", ex);
    }
  }

  private Map<String, Object> readParameters(String json, String name) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, PARAMETERS_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("job parameters are not a JSON object name=" + name, ex);
    }
  }

  private JobDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String name = rs.getString("name");
    final long intervalValue = rs.getLong("interval_seconds");
    final Long intervalSeconds = rs.wasNull() ? null : intervalValue;
    final JobSchedule schedule =
        new JobSchedule(
            JobSchedule.ScheduleType.valueOf(rs.getString("schedule_type")),
            intervalSeconds,
            rs.getString("cron_expression"),
            ZoneId.of(rs.getString("schedule_zone")));
    final int timeoutSeconds = rs.getInt("timeout_seconds");
    final Integer timeout = rs.wasNull() ? null : timeoutSeconds;
    final String lastStatus = rs.getString("last_status");
    return new JobDefinition(
        name,
        rs.getString("template_type"),
        schedule,
        readParameters(rs.getString("parameters_json_text"), name),
        rs.getBoolean("enabled"),
        timeout,
        toInstant(rs.getTimestamp("next_run_at")),
        toInstant(rs.getTimestamp("last_run_at")),
        lastStatus == null ? null : JobExecutionStatus.valueOf(lastStatus),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
