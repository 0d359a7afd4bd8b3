/*
 * Where: pipeline job layer
 * What: outcome of one template execution
 * Why: stored as the execution row's status and result_json
 */
package com.example.matrimony.pipeline.job;

import com.example.matrimony.pipeline.model.JobExecutionStatus;
import java.util.List;
import java.util.Map;

public record JobResult(
    JobExecutionStatus status, String message, Map<String, Object> detail, List<String> errors) {

  public JobResult {
    if (status == null || status == JobExecutionStatus.RUNNING) {
      throw new IllegalArgumentException("a job result must be terminal");
    }
    detail = detail == null ? Map.of() : detail;
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static JobResult success(String message, Map<String, Object> detail) {
    return new JobResult(JobExecutionStatus.SUCCESS, message, detail, List.of());
  }

  public static JobResult partial(String message, Map<String, Object> detail, List<String> errors) {
    return new JobResult(JobExecutionStatus.PARTIAL, message, detail, errors);
  }

  public static JobResult failure(String message, Map<String, Object> detail, List<String> errors) {
    return new JobResult(JobExecutionStatus.FAILURE, message, detail, errors);
  }

  public static JobResult failure(String message) {
    return failure(message, Map.of(), List.of(message));
  }
}
