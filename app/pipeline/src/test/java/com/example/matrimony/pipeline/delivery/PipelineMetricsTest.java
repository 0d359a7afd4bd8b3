/*
 * Where: pipeline metrics test
 * What: delivery, latency, opt-out, job and backlog meters are registered and recorded
 */
package com.example.matrimony.pipeline.delivery;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.matrimony.pipeline.model.JobExecutionStatus;
import com.example.matrimony.pipeline.model.NotificationChannel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class PipelineMetricsTest {

  @Test
  void recordsDeliveryJobAndBacklogMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final PipelineMetrics metrics = new PipelineMetrics(registry);

    final Instant createdAt = Instant.parse("2026-02-24T00:00:00Z");
    final Instant sentAt = Instant.parse("2026-02-24T00:00:10Z");

    metrics.recordDelivery(NotificationChannel.EMAIL, "sent");
    metrics.recordDelivery(NotificationChannel.EMAIL, "sent");
    metrics.recordDeliveryLatency(createdAt, sentAt);
    metrics.recordDeliveryLatency(sentAt, createdAt);
    metrics.recordOptOutSync(NotificationChannel.SMS);
    metrics.recordJobExecution("email_drain", JobExecutionStatus.PARTIAL, Duration.ofSeconds(2));
    metrics.updateBacklog(NotificationChannel.PUSH, 5);

    final Counter sent =
        registry
            .get("pipeline.delivery.total")
            .tag("channel", "email")
            .tag("result", "sent")
            .counter();
    final Timer latency = registry.get("pipeline.delivery.latency").timer();
    final Counter optOut = registry.get("pipeline.opt_out.sync.total").tag("channel", "sms").counter();
    final Counter jobs =
        registry
            .get("pipeline.job.execution.total")
            .tag("template", "email_drain")
            .tag("status", "PARTIAL")
            .counter();
    final Timer jobDuration = registry.get("pipeline.job.execution.duration").timer();
    final Gauge pushBacklog =
        registry.get("pipeline.queue.backlog.current").tag("channel", "push").gauge();
    final Gauge emailBacklog =
        registry.get("pipeline.queue.backlog.current").tag("channel", "email").gauge();

    assertThat(sent.count()).isEqualTo(2.0d);
    // a send time before the enqueue time is ignored
    assertThat(latency.count()).isEqualTo(1L);
    assertThat(optOut.count()).isEqualTo(1.0d);
    assertThat(jobs.count()).isEqualTo(1.0d);
    assertThat(jobDuration.count()).isEqualTo(1L);
    assertThat(pushBacklog.value()).isEqualTo(5.0d);
    assertThat(emailBacklog.value()).isZero();
  }
}
