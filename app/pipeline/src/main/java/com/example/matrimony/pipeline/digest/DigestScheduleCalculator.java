/*
 * Where: pipeline digest processing
 * What: computes when a scheduled notification is next due
 * Why: an admin override always wins over the owner's recurrence
 */
package com.example.matrimony.pipeline.digest;

import com.example.matrimony.pipeline.model.AdminOverride;
import com.example.matrimony.pipeline.model.Recurrence;
import com.example.matrimony.pipeline.model.ScheduledNotification;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import org.springframework.stereotype.Component;

@Component
public class DigestScheduleCalculator {

  /**
   * Recurrence in force for the schedule, or {@code null} when a disabled override suppresses it.
   */
  public Recurrence effectiveRecurrence(ScheduledNotification schedule) {
    final AdminOverride override = schedule.adminOverride();
    if (override == null) {
      return schedule.recurrence();
    }
    if (override.disabled()) {
      return null;
    }
    return override.recurrence() != null ? override.recurrence() : schedule.recurrence();
  }

  /**
   * First occurrence strictly after the last send (or after creation when never sent), or {@code
   * null} when the schedule is suppressed.
   */
  public Instant nextDue(ScheduledNotification schedule) {
    final Recurrence recurrence = effectiveRecurrence(schedule);
    if (recurrence == null) {
      return null;
    }
    final Instant base =
        schedule.lastSentAt() != null
            ? schedule.lastSentAt()
            : schedule.createdAt() != null ? schedule.createdAt() : Instant.EPOCH;
    return nextOccurrence(recurrence, base);
  }

  public boolean isDue(ScheduledNotification schedule, Instant now) {
    final Instant due = nextDue(schedule);
    return due != null && !due.isAfter(now);
  }

  Instant nextOccurrence(Recurrence recurrence, Instant after) {
    final ZonedDateTime base = after.atZone(recurrence.zone());
    ZonedDateTime candidate = base.with(recurrence.timeOfDay()).withSecond(0).withNano(0);
    if (recurrence.frequency() == Recurrence.Frequency.WEEKLY) {
      candidate = candidate.with(TemporalAdjusters.nextOrSame(recurrence.dayOfWeek()));
      if (!candidate.isAfter(base)) {
        candidate = candidate.plusWeeks(1);
      }
    } else if (!candidate.isAfter(base)) {
      candidate = candidate.plusDays(1);
    }
    return candidate.toInstant();
  }
}
