/*
 * Where: pipeline configuration binding
 * What: default quiet hours and per-channel send rate limits
 * Why: recipients without their own quiet hours fall back to the platform window
 */
package com.example.matrimony.pipeline.config;

import com.example.matrimony.pipeline.model.QuietHoursWindow;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "pipeline.delivery.policy")
@Validated
public record DeliveryPolicyProperties(
    @Valid @DefaultValue QuietHours quietHours, Map<String, @Valid RateLimit> rateLimits) {

  public DeliveryPolicyProperties {
    rateLimits = rateLimits == null ? Map.of() : Map.copyOf(rateLimits);
  }

  /** Limit for a channel's stored name, or {@code null} when the channel is unlimited. */
  public RateLimit rateLimitFor(String channel) {
    return rateLimits.get(channel);
  }

  /** Start and end are local times ({@code HH:mm}) in {@code zone}. */
  public record QuietHours(
      @DefaultValue("false") boolean enabled,
      @DefaultValue("22:00") String start,
      @DefaultValue("08:00") String end,
      @DefaultValue("UTC") String zone) {

    @AssertTrue(message = "pipeline.delivery.policy.quiet-hours needs HH:mm times and a valid zone")
    public boolean isWindowParsable() {
      try {
        toWindow();
        return true;
      } catch (DateTimeException | NullPointerException ex) {
        return false;
      }
    }

    public QuietHoursWindow toWindow() {
      return new QuietHoursWindow(enabled, LocalTime.parse(start), LocalTime.parse(end), ZoneId.of(zone));
    }
  }

  public record RateLimit(@NotNull @Positive Integer maxCount, @NotNull Duration period) {

    @AssertTrue(message = "rate limit period must be positive")
    public boolean isPeriodPositive() {
      return period != null && !period.isZero() && !period.isNegative();
    }
  }
}
