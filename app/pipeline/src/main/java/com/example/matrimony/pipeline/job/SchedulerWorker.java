/*
 * Where: pipeline scheduler worker
 * What: triggers a scheduler tick at a fixed delay
 */
package com.example.matrimony.pipeline.job;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "pipeline.scheduler.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SchedulerWorker {

  private final JobScheduler jobScheduler;

  @Scheduled(fixedDelayString = "${pipeline.scheduler.poll-interval}")
  public void run() {
    jobScheduler.pollOnce();
  }
}
