/*
 * Where: pipeline data access
 * What: job_executions claim, completion and history queries
 * Why: the RUNNING row is the only lock the scheduler takes
 */
package com.example.matrimony.pipeline.repository;

import static com.example.matrimony.common.JdbcTimestampUtils.toInstant;
import static com.example.matrimony.common.JdbcTimestampUtils.toTimestamp;

import com.example.matrimony.pipeline.model.JobExecutionRecord;
import com.example.matrimony.pipeline.model.JobExecutionStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JobExecutionRepository {

  public static final String ABANDONED_MESSAGE = "execution abandoned";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Inserts the RUNNING row for a job. Returns {@code false} when another execution of the same job
   * is still RUNNING; the partial unique index on job_name rejects the second row.
   */
  public boolean insertRunningIfAbsent(
      UUID executionId,
      String jobName,
      String templateType,
      Instant startedAt,
      String triggeredBy,
      String executedBy) {
    final String sql =
        """
        INSERT INTO job_executions (
          execution_id,
          job_name,
          template_type,
          status,
          started_at,
          triggered_by,
          executed_by
        ) VALUES (
          :executionId,
          :jobName,
          :templateType,
          'RUNNING',
          :startedAt,
          :triggeredBy,
          :executedBy
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("executionId", executionId)
            .addValue("jobName", jobName)
            .addValue("templateType", templateType)
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("triggeredBy", triggeredBy)
            .addValue("executedBy", executedBy);
    try {
      return jdbcTemplate.update(sql, params) > 0;
    } catch (DuplicateKeyException ex) {
      return false;
    }
  }

  public int complete(
      UUID executionId,
      JobExecutionStatus status,
      Instant finishedAt,
      String resultJson,
      String errorMessage) {
    final String sql =
        """
        UPDATE job_executions
        SET status = :status,
            finished_at = :finishedAt,
            result_json = :resultJson::jsonb,
            error_message = :errorMessage
        WHERE execution_id = :executionId
          AND status = 'RUNNING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("resultJson", resultJson)
            .addValue("errorMessage", errorMessage)
            .addValue("executionId", executionId);
    return jdbcTemplate.update(sql, params);
  }

  /**
   * Closes RUNNING rows that outlived their job's timeout plus the grace period as FAILURE, so a
   * crashed run never blocks its job. Jobs without their own timeout use {@code defaultTimeoutSeconds}.
   */
  public int failStaleRunning(Instant now, long defaultTimeoutSeconds, long graceSeconds) {
    final String sql =
        """
        UPDATE job_executions e
        SET status = 'FAILURE',
            finished_at = :now,
            error_message = :errorMessage
        FROM job_definitions d
        WHERE e.job_name = d.name
          AND e.status = 'RUNNING'
          AND e.started_at
              + make_interval(secs => COALESCE(d.timeout_seconds, :defaultTimeoutSeconds) + :graceSeconds)
              < :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("errorMessage", ABANDONED_MESSAGE)
            .addValue("defaultTimeoutSeconds", defaultTimeoutSeconds)
            .addValue("graceSeconds", graceSeconds);
    return jdbcTemplate.update(sql, params);
  }

  public List<JobExecutionRecord> findByJobName(String jobName, int limit) {
    final String sql =
        """
        SELECT execution_id, job_name, template_type, status, started_at, finished_at,
               result_json::text AS result_json_text, error_message, triggered_by, executed_by
        FROM job_executions
        WHERE job_name = :jobName
        ORDER BY started_at DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobName", jobName).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countRunning(String jobName) {
    final String sql =
        "SELECT COUNT(*) FROM job_executions WHERE job_name = :jobName AND status = 'RUNNING'";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobName", jobName);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private JobExecutionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new JobExecutionRecord(
        UUID.fromString(rs.getString("execution_id")),
        rs.getString("job_name"),
        rs.getString("template_type"),
        JobExecutionStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("finished_at")),
        rs.getString("result_json_text"),
        rs.getString("error_message"),
        rs.getString("triggered_by"),
        rs.getString("executed_by"));
  }
}
