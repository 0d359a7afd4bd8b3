/*
 * Where: pipeline domain model
 * What: daily or weekly recurrence of a scheduled notification
 * Why: both the owner's setting and an admin override use the same shape
 */
package com.example.matrimony.pipeline.model;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

public record Recurrence(Frequency frequency, DayOfWeek dayOfWeek, LocalTime timeOfDay, ZoneId zone) {

  public enum Frequency {
    DAILY,
    WEEKLY
  }

  public Recurrence {
    if (frequency == null) {
      throw new IllegalArgumentException("frequency is required");
    }
    if (frequency == Frequency.WEEKLY && dayOfWeek == null) {
      throw new IllegalArgumentException("weekly recurrence requires dayOfWeek");
    }
    timeOfDay = timeOfDay == null ? LocalTime.of(9, 0) : timeOfDay;
    zone = zone == null ? ZoneOffset.UTC : zone;
  }

  public static Recurrence daily(LocalTime timeOfDay, ZoneId zone) {
    return new Recurrence(Frequency.DAILY, null, timeOfDay, zone);
  }

  public static Recurrence weekly(DayOfWeek dayOfWeek, LocalTime timeOfDay, ZoneId zone) {
    return new Recurrence(Frequency.WEEKLY, dayOfWeek, timeOfDay, zone);
  }
}
