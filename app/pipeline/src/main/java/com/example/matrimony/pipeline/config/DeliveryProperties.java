/*
 * Where: pipeline configuration binding
 * What: retry limits, send timeout and failure injection for channel delivery
 * Why: delivery limits differ between local, CI and production runs
 */
package com.example.matrimony.pipeline.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "pipeline.delivery")
@Validated
public record DeliveryProperties(
    @NotNull @Positive Integer defaultMaxAttempts,
    @NotNull Duration sendTimeout,
    @NotNull @Positive Integer senderPoolSize,
    @NotNull @Positive Integer errorMessageMaxLength,
    @Valid @DefaultValue FailureInjection failureInjection) {

  @AssertTrue(message = "pipeline.delivery.send-timeout must be positive")
  public boolean isSendTimeoutPositive() {
    return sendTimeout != null && !sendTimeout.isZero() && !sendTimeout.isNegative();
  }

  /** Test-only switch that makes sends to matching addresses fail with a fixed provider error. */
  public record FailureInjection(
      boolean enabled, String recipientPrefix, @DefaultValue("provider unavailable") String errorMessage) {}
}
