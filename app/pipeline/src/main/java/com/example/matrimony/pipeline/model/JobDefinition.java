/*
 * Where: pipeline domain model
 * What: snapshot of a job_definitions row
 * Why: shared by the scheduler, the runner and the debug API
 */
package com.example.matrimony.pipeline.model;

import java.time.Instant;
import java.util.Map;

public record JobDefinition(
    String name,
    String templateType,
    JobSchedule schedule,
    Map<String, Object> parameters,
    boolean enabled,
    Integer timeoutSeconds,
    Instant nextRunAt,
    Instant lastRunAt,
    JobExecutionStatus lastStatus,
    Instant createdAt,
    Instant updatedAt) {

  public JobDefinition {
    parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
  }
}
