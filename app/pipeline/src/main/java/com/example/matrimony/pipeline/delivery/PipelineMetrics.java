/*
 * Where: pipeline delivery and scheduling
 * What: records delivery outcomes, opt-out syncs, job executions and queue backlog
 * Why: queue health and job outcomes are observed from Prometheus
 */
package com.example.matrimony.pipeline.delivery;

import com.example.matrimony.pipeline.model.JobExecutionStatus;
import com.example.matrimony.pipeline.model.NotificationChannel;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class PipelineMetrics {

  static final String METRIC_DELIVERY_TOTAL = "pipeline.delivery.total";
  static final String METRIC_DELIVERY_LATENCY = "pipeline.delivery.latency";
  static final String METRIC_OPT_OUT_SYNC_TOTAL = "pipeline.opt_out.sync.total";
  static final String METRIC_BACKLOG_CURRENT = "pipeline.queue.backlog.current";
  static final String METRIC_JOB_EXECUTION_TOTAL = "pipeline.job.execution.total";
  static final String METRIC_JOB_EXECUTION_DURATION = "pipeline.job.execution.duration";

  private final MeterRegistry meterRegistry;
  private final Map<NotificationChannel, AtomicInteger> backlog =
      new EnumMap<>(NotificationChannel.class);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> timers = new ConcurrentHashMap<>();
  private final Timer deliveryLatencyTimer;

  public PipelineMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    for (NotificationChannel channel : NotificationChannel.values()) {
      final AtomicInteger value = new AtomicInteger(0);
      backlog.put(channel, value);
      Gauge.builder(METRIC_BACKLOG_CURRENT, value, AtomicInteger::get)
          .description("Current number of pending notifications")
          .tags(Tags.of("channel", channel.value()))
          .register(meterRegistry);
    }
    this.deliveryLatencyTimer =
        Timer.builder(METRIC_DELIVERY_LATENCY)
            .description("Delay from enqueue to successful send")
            .register(meterRegistry);
  }

  /** {@code result} is one of sent, retried, failed, exhausted, opted_out, invalid_recipient. */
  public void recordDelivery(NotificationChannel channel, String result) {
    counter(
            METRIC_DELIVERY_TOTAL,
            "Notification delivery outcomes",
            Tags.of("channel", channel.value(), "result", result))
        .increment();
  }

  public void recordDeliveryLatency(Instant createdAt, Instant sentAt) {
    if (createdAt == null || sentAt == null || sentAt.isBefore(createdAt)) {
      return;
    }
    deliveryLatencyTimer.record(Duration.between(createdAt, sentAt));
  }

  public void recordOptOutSync(NotificationChannel channel) {
    counter(
            METRIC_OPT_OUT_SYNC_TOTAL,
            "Channel opt-ins revoked after provider opt-out responses",
            Tags.of("channel", channel.value()))
        .increment();
  }

  public void recordJobExecution(String templateType, JobExecutionStatus status, Duration elapsed) {
    final Tags tags = Tags.of("template", templateType, "status", status.name());
    counter(METRIC_JOB_EXECUTION_TOTAL, "Job executions by template and outcome", tags).increment();
    if (elapsed != null && !elapsed.isNegative()) {
      timers
          .computeIfAbsent(
              METRIC_JOB_EXECUTION_DURATION + tags,
              ignored ->
                  Timer.builder(METRIC_JOB_EXECUTION_DURATION)
                      .description("Job execution wall time")
                      .tags(tags)
                      .register(meterRegistry))
          .record(elapsed);
    }
  }

  public void updateBacklog(NotificationChannel channel, int pendingCount) {
    backlog.get(channel).set(Math.max(pendingCount, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    return counters.computeIfAbsent(
        name + tags,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
