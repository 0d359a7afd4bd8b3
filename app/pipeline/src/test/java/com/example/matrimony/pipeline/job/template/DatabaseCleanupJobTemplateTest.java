/*
 * Where: pipeline job template test
 * What: per-target isolation, dry-run and parameter validation of the cleanup job
 * Why: one failing table must not hide the results of the others
 */
package com.example.matrimony.pipeline.job.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.matrimony.pipeline.job.InvalidJobParametersException;
import com.example.matrimony.pipeline.job.JobContext;
import com.example.matrimony.pipeline.job.JobParameters;
import com.example.matrimony.pipeline.job.JobResult;
import com.example.matrimony.pipeline.model.JobDefinition;
import com.example.matrimony.pipeline.model.JobExecutionRecord;
import com.example.matrimony.pipeline.model.JobExecutionStatus;
import com.example.matrimony.pipeline.model.JobSchedule;
import com.example.matrimony.pipeline.repository.CollectionCleanupRepository;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.BadSqlGrammarException;

@ExtendWith(MockitoExtension.class)
class DatabaseCleanupJobTemplateTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T03:30:00Z");

  @Mock private CollectionCleanupRepository cleanupRepository;

  @Test
  void failingTargetMakesTheRunPartialAndOthersStillRun() {
    when(cleanupRepository.deleteOlderThan("logs", "created_at", FIXED_NOW.minus(Duration.ofDays(2))))
        .thenReturn(12);
    when(cleanupRepository.deleteOlderThan(
            "activity_logs", "created_at", FIXED_NOW.minus(Duration.ofDays(5))))
        .thenThrow(new BadSqlGrammarException("cleanup", "DELETE", new SQLException("relation missing")));
    when(cleanupRepository.deleteOlderThan(
            "job_executions", "started_at", FIXED_NOW.minus(Duration.ofDays(3))))
        .thenReturn(4);
    final DatabaseCleanupJobTemplate template = new DatabaseCleanupJobTemplate(cleanupRepository);

    final JobResult result =
        template.execute(
            context(
                Map.of(
                    "targets",
                    List.of(
                        Map.of("collection", "logs", "ageThresholdDays", 2),
                        Map.of("collection", "activity_logs", "ageThresholdDays", 5),
                        Map.of(
                            "collection",
                            "job_executions",
                            "ageThresholdDays",
                            3,
                            "timestampField",
                            "started_at")))));

    assertThat(result.status()).isEqualTo(JobExecutionStatus.PARTIAL);
    assertThat(result.errors()).singleElement().asString().startsWith("activity_logs:");
    @SuppressWarnings("unchecked")
    final List<Map<String, Object>> targets = (List<Map<String, Object>>) result.detail().get("targets");
    assertThat(targets).hasSize(3);
    assertThat(targets.get(0)).containsEntry("deleted", 12).containsEntry("status", "success");
    assertThat(targets.get(1)).containsEntry("status", "failed").containsKey("error");
    assertThat(targets.get(2)).containsEntry("deleted", 4).containsEntry("status", "success");
  }

  @Test
  void dryRunCountsInsteadOfDeleting() {
    when(cleanupRepository.countOlderThan(
            "notification_log", "created_at", FIXED_NOW.minus(Duration.ofDays(90))))
        .thenReturn(40);
    final DatabaseCleanupJobTemplate template = new DatabaseCleanupJobTemplate(cleanupRepository);

    final JobResult result =
        template.execute(
            context(
                Map.of(
                    "dryRun",
                    true,
                    "targets",
                    List.of(Map.of("collection", "notification_log", "ageThresholdDays", 90)))));

    assertThat(result.status()).isEqualTo(JobExecutionStatus.SUCCESS);
    assertThat(result.detail()).containsEntry("dryRun", true);
    verify(cleanupRepository, never()).deleteOlderThan(anyString(), anyString(), any());
  }

  @Test
  void allTargetsFailingIsAFailure() {
    when(cleanupRepository.deleteOlderThan(anyString(), anyString(), any()))
        .thenThrow(new IllegalStateException("database down"));
    final DatabaseCleanupJobTemplate template = new DatabaseCleanupJobTemplate(cleanupRepository);

    final JobResult result =
        template.execute(
            context(Map.of("targets", List.of(Map.of("collection", "notification_log", "ageThresholdDays", 1)))));

    assertThat(result.status()).isEqualTo(JobExecutionStatus.FAILURE);
  }

  @Test
  void validationRejectsUnlistedCollectionsAndBadFields() {
    when(cleanupRepository.isAllowed("users")).thenReturn(false);
    when(cleanupRepository.isAllowed("notification_log")).thenReturn(true);
    final DatabaseCleanupJobTemplate template = new DatabaseCleanupJobTemplate(cleanupRepository);

    assertThatThrownBy(
            () ->
                template.validateParameters(
                    JobParameters.of(
                        Map.of("targets", List.of(Map.of("collection", "users", "ageThresholdDays", 1))))))
        .isInstanceOf(InvalidJobParametersException.class)
        .hasMessageContaining("not allowed");
    assertThatThrownBy(
            () ->
                template.validateParameters(
                    JobParameters.of(
                        Map.of(
                            "targets",
                            List.of(
                                Map.of(
                                    "collection",
                                    "notification_log",
                                    "ageThresholdDays",
                                    1,
                                    "timestampField",
                                    "created_at; DROP TABLE x"))))))
        .isInstanceOf(InvalidJobParametersException.class)
        .hasMessageContaining("invalid timestampField");
    assertThatThrownBy(() -> template.validateParameters(JobParameters.of(Map.of())))
        .isInstanceOf(InvalidJobParametersException.class);
    assertThatThrownBy(
            () ->
                template.validateParameters(
                    JobParameters.of(
                        Map.of("targets", List.of(Map.of("collection", "notification_log", "ageThresholdDays", 0))))))
        .isInstanceOf(InvalidJobParametersException.class);
  }

  private JobContext context(Map<String, Object> parameters) {
    final JobDefinition definition =
        new JobDefinition(
            "nightly-cleanup",
            DatabaseCleanupJobTemplate.TYPE,
            JobSchedule.cron("0 30 3 * * *", ZoneOffset.UTC),
            parameters,
            true,
            1800,
            FIXED_NOW,
            null,
            null,
            FIXED_NOW,
            FIXED_NOW);
    return new JobContext(
        definition,
        UUID.randomUUID(),
        JobParameters.of(definition.parameters()),
        FIXED_NOW,
        JobExecutionRecord.TRIGGERED_BY_SCHEDULER);
  }
}
