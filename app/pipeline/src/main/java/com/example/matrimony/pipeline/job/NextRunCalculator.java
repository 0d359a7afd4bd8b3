/*
 * Where: pipeline job layer
 * What: computes the next run instant of a schedule
 * Why: the next run is always derived from the moment an execution ends, never from the old due time
 */
package com.example.matrimony.pipeline.job;

import com.example.matrimony.pipeline.model.JobSchedule;
import java.time.Instant;
import java.time.ZonedDateTime;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

@Component
public class NextRunCalculator {

  /**
   * Returns the first run strictly after {@code now}, or {@code null} when a cron expression has no
   * future match.
   */
  public Instant next(JobSchedule schedule, Instant now) {
    return switch (schedule.type()) {
      case INTERVAL -> now.plusSeconds(schedule.intervalSeconds());
      case CRON -> {
        final ZonedDateTime next =
            parse(schedule.cronExpression()).next(now.atZone(schedule.zone()));
        yield next == null ? null : next.toInstant();
      }
    };
  }

  /**
   * Parses a 5-field (minute-first) or 6-field (second-first) cron expression.
   *
   * @throws IllegalArgumentException when the expression is invalid
   */
  public CronExpression parse(String expression) {
    final String trimmed = expression == null ? "" : expression.trim();
    final String[] fields = trimmed.split("\\s+");
    if (fields.length == 5) {
      return CronExpression.parse("0 " + trimmed);
    }
    return CronExpression.parse(trimmed);
  }
}
