/*
 * Where: pipeline job layer
 * What: one kind of executable work, selected by a definition's template type
 * Why: the scheduler stays unaware of what a job does
 */
package com.example.matrimony.pipeline.job;

public interface JobTemplate {

  /** Stable type name stored in job_definitions.template_type. */
  String type();

  /**
   * Rejects parameter bags this template cannot run with.
   *
   * @throws InvalidJobParametersException when a parameter is missing, mistyped or out of range
   */
  void validateParameters(JobParameters parameters);

  /**
   * Runs the job once. Implementations report partial outcomes through {@link JobResult}; a thrown
   * exception is recorded as FAILURE. Long-running work should stop when the thread is interrupted.
   */
  JobResult execute(JobContext context);
}
