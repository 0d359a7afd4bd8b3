/*
 * Where: pipeline job template test
 * What: drain parameters, test-mode redirection and status mapping
 */
package com.example.matrimony.pipeline.job.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.example.matrimony.pipeline.delivery.DrainSummary;
import com.example.matrimony.pipeline.delivery.NotificationDeliveryService;
import com.example.matrimony.pipeline.job.InvalidJobParametersException;
import com.example.matrimony.pipeline.job.JobContext;
import com.example.matrimony.pipeline.job.JobParameters;
import com.example.matrimony.pipeline.job.JobResult;
import com.example.matrimony.pipeline.model.JobDefinition;
import com.example.matrimony.pipeline.model.JobExecutionRecord;
import com.example.matrimony.pipeline.model.JobExecutionStatus;
import com.example.matrimony.pipeline.model.JobSchedule;
import com.example.matrimony.pipeline.model.NotificationChannel;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChannelDrainJobTemplateTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private NotificationDeliveryService deliveryService;

  @Test
  void cleanDrainSucceedsWithCountsInDetail() {
    final EmailDrainJobTemplate template = new EmailDrainJobTemplate(deliveryService);
    when(deliveryService.drain(NotificationChannel.EMAIL, 100, null))
        .thenReturn(new DrainSummary(7, 0, 0));

    final JobResult result = template.execute(context(template.type(), Map.of()));

    assertThat(result.status()).isEqualTo(JobExecutionStatus.SUCCESS);
    assertThat(result.detail())
        .containsEntry("channel", "email")
        .containsEntry("sent", 7)
        .containsEntry("total", 7)
        .containsEntry("testMode", false);
  }

  @Test
  void failuresOrRetriesMakeTheRunPartial() {
    final SmsDrainJobTemplate template = new SmsDrainJobTemplate(deliveryService);
    when(deliveryService.drain(NotificationChannel.SMS, 20, null))
        .thenReturn(new DrainSummary(3, 1, 2));

    final JobResult result = template.execute(context(template.type(), Map.of("batchSize", 20)));

    assertThat(result.status()).isEqualTo(JobExecutionStatus.PARTIAL);
    assertThat(result.detail()).containsEntry("failed", 1).containsEntry("retried", 2);
  }

  @Test
  void testModeRedirectsToTheLegacyAddressKey() {
    final SmsDrainJobTemplate template = new SmsDrainJobTemplate(deliveryService);
    when(deliveryService.drain(NotificationChannel.SMS, 50, "+15559990000"))
        .thenReturn(new DrainSummary(1, 0, 0));

    final JobResult result =
        template.execute(
            context(template.type(), Map.of("testMode", true, "testPhone", "+15559990000")));

    assertThat(result.detail()).containsEntry("testMode", true);
  }

  @Test
  void validationRejectsOversizedBatchAndTestModeWithoutAddress() {
    final SmsDrainJobTemplate sms = new SmsDrainJobTemplate(deliveryService);
    final PushDrainJobTemplate push = new PushDrainJobTemplate(deliveryService);

    assertThatThrownBy(() -> sms.validateParameters(JobParameters.of(Map.of("batchSize", 101))))
        .isInstanceOf(InvalidJobParametersException.class);
    assertThatThrownBy(() -> push.validateParameters(JobParameters.of(Map.of("testMode", true))))
        .isInstanceOf(InvalidJobParametersException.class)
        .hasMessageContaining("testAddress");
    push.validateParameters(JobParameters.of(Map.of("batchSize", 500)));
  }

  private JobContext context(String templateType, Map<String, Object> parameters) {
    final JobDefinition definition =
        new JobDefinition(
            templateType + "-job",
            templateType,
            JobSchedule.interval(60),
            parameters,
            true,
            null,
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
