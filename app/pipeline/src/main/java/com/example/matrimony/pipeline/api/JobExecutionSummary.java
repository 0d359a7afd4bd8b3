/*
 * Where: pipeline debug API model
 * What: one job execution row with its parsed result
 */
package com.example.matrimony.pipeline.api;

import com.example.matrimony.pipeline.model.JobExecutionStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobExecutionSummary(
    UUID executionId,
    JobExecutionStatus status,
    String triggeredBy,
    String executedBy,
    Instant startedAt,
    Instant finishedAt,
    String errorMessage,
    JsonNode result) {}
