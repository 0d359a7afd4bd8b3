package com.example.matrimony.pipeline.job;

import com.example.matrimony.pipeline.model.JobDefinition;
import java.time.Instant;
import java.util.UUID;

/** What a template sees of the execution it runs in. */
public record JobContext(
    JobDefinition definition,
    UUID executionId,
    JobParameters parameters,
    Instant startedAt,
    String triggeredBy) {

  public String jobName() {
    return definition.name();
  }
}
