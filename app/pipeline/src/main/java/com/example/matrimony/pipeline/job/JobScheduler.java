/*
 * Where: pipeline job layer
 * What: one polling tick: release stale claims, select due jobs, claim and dispatch them
 * Why: the RUNNING execution row is the claim, so a job never overlaps with itself
 */
package com.example.matrimony.pipeline.job;

import com.example.matrimony.pipeline.config.ExecutorConfig;
import com.example.matrimony.pipeline.config.SchedulerProperties;
import com.example.matrimony.pipeline.model.JobDefinition;
import com.example.matrimony.pipeline.model.JobExecutionRecord;
import com.example.matrimony.pipeline.model.JobExecutionStatus;
import com.example.matrimony.pipeline.repository.JobDefinitionRepository;
import com.example.matrimony.pipeline.repository.JobExecutionRepository;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class JobScheduler {

  private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final JobDefinitionRepository definitionRepository;
  private final JobExecutionRepository executionRepository;
  private final JobRunner jobRunner;
  private final SchedulerProperties properties;
  private final Clock clock;
  private final ExecutorService dispatchExecutor;
  private final String executedBy;

  public JobScheduler(
      JobDefinitionRepository definitionRepository,
      JobExecutionRepository executionRepository,
      JobRunner jobRunner,
      SchedulerProperties properties,
      Clock clock,
      @Qualifier(ExecutorConfig.JOB_DISPATCH_EXECUTOR) ExecutorService dispatchExecutor) {
    this.definitionRepository = definitionRepository;
    this.executionRepository = executionRepository;
    this.jobRunner = jobRunner;
    this.properties = properties;
    this.clock = clock;
    this.dispatchExecutor = dispatchExecutor;
    this.executedBy = resolveExecutedBy();
  }

  /** Runs one scheduler tick. Never throws. */
  public void pollOnce() {
    final Instant now = Instant.now(clock);
    try {
      releaseStaleClaims(now);
      final List<JobDefinition> due = definitionRepository.findDue(now);
      if (!due.isEmpty()) {
        logger.debug("scheduler tick due={}", due.size());
      }
      for (JobDefinition definition : due) {
        try {
          final UUID executionId =
              claim(definition, JobExecutionRecord.TRIGGERED_BY_SCHEDULER, now);
          if (executionId == null) {
            logger.info(
                "job skipped; previous execution still running job={}", definition.name());
            continue;
          }
          dispatch(definition, executionId, now, JobExecutionRecord.TRIGGERED_BY_SCHEDULER);
        } catch (RuntimeException ex) {
          logger.error("job dispatch failed job={}", definition.name(), ex);
        }
      }
    } catch (RuntimeException ex) {
      logger.error("scheduler tick failed", ex);
    }
  }

  /**
   * Starts a job immediately through the same claim path as scheduled runs.
   *
   * @return the execution id of the claimed run
   * @throws JobNotFoundException when no definition has this name
   * @throws JobAlreadyRunningException when the job is currently RUNNING
   */
  public UUID runNow(String name, String triggeredBy) {
    final JobDefinition definition =
        definitionRepository.findByName(name).orElseThrow(() -> new JobNotFoundException(name));
    final Instant now = Instant.now(clock);
    final UUID executionId = claim(definition, triggeredBy, now);
    if (executionId == null) {
      throw new JobAlreadyRunningException(name);
    }
    logger.info("manual job run requested job={} triggeredBy={}", name, triggeredBy);
    dispatch(definition, executionId, now, triggeredBy);
    return executionId;
  }

  @VisibleForTesting
  int releaseStaleClaims(Instant now) {
    final int released =
        executionRepository.failStaleRunning(
            now, properties.defaultTimeout().toSeconds(), properties.staleGrace().toSeconds());
    if (released > 0) {
      logger.warn("stale job executions released count={}", released);
    }
    return released;
  }

  private UUID claim(JobDefinition definition, String triggeredBy, Instant now) {
    final UUID executionId = UUID.randomUUID();
    final boolean claimed =
        executionRepository.insertRunningIfAbsent(
            executionId, definition.name(), definition.templateType(), now, triggeredBy, executedBy);
    return claimed ? executionId : null;
  }

  private void dispatch(
      JobDefinition definition, UUID executionId, Instant startedAt, String triggeredBy) {
    try {
      dispatchExecutor.execute(() -> jobRunner.run(definition, executionId, startedAt, triggeredBy));
    } catch (RejectedExecutionException ex) {
      // release the claim so the job is not blocked until the stale timeout
      executionRepository.complete(
          executionId, JobExecutionStatus.FAILURE, Instant.now(clock), null, "dispatch rejected");
      throw ex;
    }
  }

  @VisibleForTesting
  String resolveExecutedBy() {
    final String configured = properties.hostName();
    if (configured != null && !configured.isBlank()) {
      return configured;
    }
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
