/*
 * Where: pipeline configuration binding
 * What: polling, pool and timeout settings of the job scheduler
 * Why: operators tune the loop per environment and bad durations fail at startup
 */
package com.example.matrimony.pipeline.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "pipeline.scheduler")
@Validated
public record SchedulerProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @NotNull @Positive Integer workerPoolSize,
    @NotNull Duration defaultTimeout,
    @NotNull Duration staleGrace,
    String hostName) {

  @AssertTrue(message = "pipeline.scheduler.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    return isPositiveDuration(pollInterval);
  }

  @AssertTrue(message = "pipeline.scheduler.default-timeout must be positive")
  public boolean isDefaultTimeoutPositive() {
    return isPositiveDuration(defaultTimeout);
  }

  @AssertTrue(message = "pipeline.scheduler.stale-grace must not be negative")
  public boolean isStaleGraceNotNegative() {
    // zero means no grace: a run past its timeout is abandoned on the next tick
    return staleGrace != null && !staleGrace.isNegative();
  }

  private boolean isPositiveDuration(Duration duration) {
    // null is reported by @NotNull
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
