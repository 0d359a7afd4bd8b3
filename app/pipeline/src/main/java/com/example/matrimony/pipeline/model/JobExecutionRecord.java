/*
 * Where: pipeline domain model
 * What: snapshot of a job_executions row
 * Why: the RUNNING row doubles as the per-job claim
 */
package com.example.matrimony.pipeline.model;

import java.time.Instant;
import java.util.UUID;

public record JobExecutionRecord(
    UUID executionId,
    String jobName,
    String templateType,
    JobExecutionStatus status,
    Instant startedAt,
    Instant finishedAt,
    String resultJson,
    String errorMessage,
    String triggeredBy,
    String executedBy) {

  public static final String TRIGGERED_BY_SCHEDULER = "scheduler";
  public static final String TRIGGERED_BY_MANUAL = "manual";
}
