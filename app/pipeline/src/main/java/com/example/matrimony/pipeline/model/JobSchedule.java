/*
 * Where: pipeline domain model
 * What: interval or cron schedule of a job definition
 * Why: the next run time is derived from this value alone
 */
package com.example.matrimony.pipeline.model;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;

public record JobSchedule(ScheduleType type, Long intervalSeconds, String cronExpression, ZoneId zone) {

  public enum ScheduleType {
    INTERVAL,
    CRON
  }

  public JobSchedule {
    if (type == null) {
      throw new IllegalArgumentException("schedule type is required");
    }
    if (type == ScheduleType.INTERVAL && (intervalSeconds == null || intervalSeconds <= 0)) {
      throw new IllegalArgumentException("interval schedule requires positive intervalSeconds");
    }
    if (type == ScheduleType.CRON && (cronExpression == null || cronExpression.isBlank())) {
      throw new IllegalArgumentException("cron schedule requires an expression");
    }
    zone = zone == null ? ZoneOffset.UTC : zone;
  }

  public static JobSchedule interval(long seconds) {
    return new JobSchedule(ScheduleType.INTERVAL, seconds, null, ZoneOffset.UTC);
  }

  public static JobSchedule cron(String expression, ZoneId zone) {
    return new JobSchedule(ScheduleType.CRON, null, expression, zone);
  }

  public static JobSchedule daily(LocalTime time, ZoneId zone) {
    return cron(String.format(Locale.ROOT, "0 %d %d * * *", time.getMinute(), time.getHour()), zone);
  }

  public static JobSchedule weekly(DayOfWeek day, LocalTime time, ZoneId zone) {
    final String dayName = day.name().substring(0, 3);
    return cron(
        String.format(Locale.ROOT, "0 %d %d * * %s", time.getMinute(), time.getHour(), dayName),
        zone);
  }
}
