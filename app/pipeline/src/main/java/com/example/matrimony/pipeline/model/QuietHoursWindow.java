/*
 * Where: pipeline domain model
 * What: daily local-time window during which non-critical notifications are held back
 * Why: recipients set their own window; the configured one applies to everyone else
 */
package com.example.matrimony.pipeline.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

public record QuietHoursWindow(boolean enabled, LocalTime start, LocalTime end, ZoneId zone) {

  public QuietHoursWindow {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    Objects.requireNonNull(zone, "zone");
  }

  public static QuietHoursWindow disabled() {
    return new QuietHoursWindow(false, LocalTime.MIDNIGHT, LocalTime.MIDNIGHT, ZoneId.of("UTC"));
  }

  /**
   * End of the window {@code now} falls in, or empty when {@code now} is outside it. A window whose
   * start is after its end spans midnight; equal start and end means no quiet time at all.
   */
  public Optional<Instant> releaseAfter(Instant now) {
    if (!enabled || start.equals(end)) {
      return Optional.empty();
    }
    final ZonedDateTime local = now.atZone(zone);
    final LocalTime time = local.toLocalTime();
    final LocalDate today = local.toLocalDate();
    if (start.isBefore(end)) {
      if (time.isBefore(start) || !time.isBefore(end)) {
        return Optional.empty();
      }
      return Optional.of(ZonedDateTime.of(today, end, zone).toInstant());
    }
    if (!time.isBefore(start)) {
      return Optional.of(ZonedDateTime.of(today.plusDays(1), end, zone).toInstant());
    }
    if (time.isBefore(end)) {
      return Optional.of(ZonedDateTime.of(today, end, zone).toInstant());
    }
    return Optional.empty();
  }
}
