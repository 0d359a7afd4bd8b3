/*
 * Where: pipeline job layer
 * What: runs one claimed execution: resolve, validate, execute with timeout, record, reschedule
 * Why: every claimed execution ends with a completed row and a new next_run_at, whatever happened
 */
package com.example.matrimony.pipeline.job;

import com.example.matrimony.pipeline.config.ExecutorConfig;
import com.example.matrimony.pipeline.config.SchedulerProperties;
import com.example.matrimony.pipeline.delivery.PipelineMetrics;
import com.example.matrimony.pipeline.model.JobDefinition;
import com.example.matrimony.pipeline.model.JobExecutionStatus;
import com.example.matrimony.pipeline.repository.JobDefinitionRepository;
import com.example.matrimony.pipeline.repository.JobExecutionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class JobRunner {

  private static final Logger logger = LoggerFactory.getLogger(JobRunner.class);
  static final String MDC_JOB_NAME = "job_name";
  static final String MDC_EXECUTION_ID = "execution_id";

  private final JobTemplateRegistry templateRegistry;
  private final JobExecutionRepository executionRepository;
  private final JobDefinitionRepository definitionRepository;
  private final NextRunCalculator nextRunCalculator;
  private final PipelineMetrics metrics;
  private final SchedulerProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final ExecutorService executionExecutor;

  public JobRunner(
      JobTemplateRegistry templateRegistry,
      JobExecutionRepository executionRepository,
      JobDefinitionRepository definitionRepository,
      NextRunCalculator nextRunCalculator,
      PipelineMetrics metrics,
      SchedulerProperties properties,
      ObjectMapper objectMapper,
      Clock clock,
      @Qualifier(ExecutorConfig.JOB_EXECUTION_EXECUTOR) ExecutorService executionExecutor) {
    this.templateRegistry = templateRegistry;
    this.executionRepository = executionRepository;
    this.definitionRepository = definitionRepository;
    this.nextRunCalculator = nextRunCalculator;
    this.metrics = metrics;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.executionExecutor = executionExecutor;
  }

  public void run(JobDefinition definition, UUID executionId, Instant startedAt, String triggeredBy) {
    MDC.put(MDC_JOB_NAME, definition.name());
    MDC.put(MDC_EXECUTION_ID, executionId.toString());
    try {
      logger.info(
          "job execution started job={} template={} triggeredBy={}",
          definition.name(),
          definition.templateType(),
          triggeredBy);
      final JobResult result = execute(definition, executionId, startedAt, triggeredBy);
      finish(definition, executionId, startedAt, result);
    } catch (RuntimeException ex) {
      // a RUNNING row left behind here is closed by the stale-claim release
      logger.error("job execution bookkeeping failed job={}", definition.name(), ex);
    } finally {
      MDC.remove(MDC_JOB_NAME);
      MDC.remove(MDC_EXECUTION_ID);
    }
  }

  JobResult execute(JobDefinition definition, UUID executionId, Instant startedAt, String triggeredBy) {
    final Optional<JobTemplate> found = templateRegistry.find(definition.templateType());
    if (found.isEmpty()) {
      return JobResult.failure("unknown template type: " + definition.templateType());
    }
    final JobTemplate template = found.get();
    final JobParameters parameters = JobParameters.of(definition.parameters());
    try {
      template.validateParameters(parameters);
    } catch (InvalidJobParametersException ex) {
      return JobResult.failure("invalid parameters: " + ex.getMessage());
    } catch (RuntimeException ex) {
      logger.warn("parameter validation failed job={}", definition.name(), ex);
      return JobResult.failure("invalid parameters: " + ex);
    }
    final JobContext context =
        new JobContext(definition, executionId, parameters, startedAt, triggeredBy);
    final Duration timeout = timeoutOf(definition);
    final Map<String, String> mdc = MDC.getCopyOfContextMap();
    final Future<JobResult> future;
    try {
      future =
          executionExecutor.submit(
              () -> {
                if (mdc != null) {
                  MDC.setContextMap(mdc);
                }
                try {
                  return template.execute(context);
                } finally {
                  MDC.clear();
                }
              });
    } catch (RejectedExecutionException ex) {
      return JobResult.failure("execution pool saturated");
    }
    try {
      final JobResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return result == null ? JobResult.failure("template returned no result") : result;
    } catch (TimeoutException ex) {
      future.cancel(true);
      return JobResult.failure("timed out after " + timeout.toSeconds() + "s");
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      logger.warn("job template threw job={}", definition.name(), cause);
      return JobResult.failure(
          cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return JobResult.failure("interrupted");
    }
  }

  private void finish(
      JobDefinition definition, UUID executionId, Instant startedAt, JobResult result) {
    final Instant finishedAt = Instant.now(clock);
    final String errorMessage = result.errors().isEmpty() ? null : String.join("; ", result.errors());
    final int completed =
        executionRepository.complete(
            executionId, result.status(), finishedAt, toJson(result), errorMessage);
    if (completed == 0) {
      logger.warn(
          "job execution row was no longer RUNNING job={} status={}",
          definition.name(),
          result.status());
    }
    final Instant nextRunAt = nextRunAt(definition, finishedAt);
    definitionRepository.updateAfterExecution(
        definition.name(), startedAt, result.status(), nextRunAt, finishedAt);
    metrics.recordJobExecution(
        definition.templateType(), result.status(), Duration.between(startedAt, finishedAt));
    if (result.status() == JobExecutionStatus.FAILURE) {
      logger.warn(
          "job execution finished job={} status={} error={} nextRunAt={}",
          definition.name(),
          result.status(),
          errorMessage,
          nextRunAt);
    } else {
      logger.info(
          "job execution finished job={} status={} message={} nextRunAt={}",
          definition.name(),
          result.status(),
          result.message(),
          nextRunAt);
    }
  }

  private Instant nextRunAt(JobDefinition definition, Instant finishedAt) {
    try {
      return nextRunCalculator.next(definition.schedule(), finishedAt);
    } catch (IllegalArgumentException ex) {
      // a null next_run_at keeps the job out of due queries until its schedule is fixed
      logger.error(
          "job schedule is invalid; job will not be selected again job={} cron={}",
          definition.name(),
          definition.schedule().cronExpression(),
          ex);
      return null;
    }
  }

  private Duration timeoutOf(JobDefinition definition) {
    final Integer seconds = definition.timeoutSeconds();
    return seconds == null || seconds <= 0 ? properties.defaultTimeout() : Duration.ofSeconds(seconds);
  }

  private String toJson(JobResult result) {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("message", result.message());
    body.put("detail", result.detail());
    body.put("errors", result.errors());
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException ex) {
      logger.warn("job result is not serializable; storing message only", ex);
      return null;
    }
  }
}
