/*
 * Where: pipeline job templates
 * What: enqueues due scheduled notifications (digests) to their recipients
 * Why: recurring messages flow through the same queue and drains as event notifications
 */
package com.example.matrimony.pipeline.job.template;

import com.example.matrimony.pipeline.delivery.NotificationQueueService;
import com.example.matrimony.pipeline.digest.DigestScheduleCalculator;
import com.example.matrimony.pipeline.job.JobContext;
import com.example.matrimony.pipeline.job.JobParameters;
import com.example.matrimony.pipeline.job.JobResult;
import com.example.matrimony.pipeline.job.JobTemplate;
import com.example.matrimony.pipeline.model.RecipientScope;
import com.example.matrimony.pipeline.model.ScheduledNotification;
import com.example.matrimony.pipeline.model.UserProfile;
import com.example.matrimony.pipeline.repository.ScheduledNotificationRepository;
import com.example.matrimony.pipeline.user.UserDisplay;
import com.example.matrimony.pipeline.user.UserProfileLookup;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Component
@RequiredArgsConstructor
public class ScheduledDigestJobTemplate implements JobTemplate {

  public static final String TYPE = "scheduled_digest_processor";

  static final String MAX_PER_RUN = "maxPerRun";
  static final String PAGE_SIZE = "pageSize";
  static final int DEFAULT_MAX_PER_RUN = 100;
  static final int DEFAULT_PAGE_SIZE = 200;
  static final int MAX_RECIPIENTS_CAP = 1000;

  private static final Logger logger = LoggerFactory.getLogger(ScheduledDigestJobTemplate.class);
  private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {};

  private final ScheduledNotificationRepository scheduleRepository;
  private final DigestScheduleCalculator scheduleCalculator;
  private final UserProfileLookup userProfileLookup;
  private final NotificationQueueService queueService;
  private final PlatformTransactionManager transactionManager;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public void validateParameters(JobParameters parameters) {
    parameters.getInt(MAX_PER_RUN, DEFAULT_MAX_PER_RUN, 1, 1000);
    parameters.getInt(PAGE_SIZE, DEFAULT_PAGE_SIZE, 1, 1000);
  }

  @Override
  public JobResult execute(JobContext context) {
    final int maxPerRun = context.parameters().getInt(MAX_PER_RUN, DEFAULT_MAX_PER_RUN, 1, 1000);
    final Instant now = Instant.now(clock);
    final int pageSize = context.parameters().getInt(PAGE_SIZE, DEFAULT_PAGE_SIZE, 1, 1000);
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    int processed = 0;
    int enqueued = 0;
    int skipped = 0;
    final List<String> errors = new ArrayList<>();

    // maxPerRun bounds due schedules attempted, not rows scanned
    UUID cursor = null;
    boolean exhausted = false;
    while (!exhausted && processed + errors.size() < maxPerRun) {
      final List<ScheduledNotification> page = scheduleRepository.findEnabledPage(cursor, pageSize);
      exhausted = page.size() < pageSize;
      for (ScheduledNotification schedule : page) {
        cursor = schedule.scheduleId();
        if (Thread.currentThread().isInterrupted()) {
          exhausted = true;
          break;
        }
        if (!scheduleCalculator.isDue(schedule, now)) {
          skipped++;
          continue;
        }
        try {
          final Integer count = transactionTemplate.execute(status -> process(schedule, now));
          enqueued += count == null ? 0 : count;
          processed++;
        } catch (RuntimeException ex) {
          errors.add("schedule " + schedule.scheduleId() + ": " + ex.getMessage());
          logger.warn("scheduled notification failed scheduleId={}", schedule.scheduleId(), ex);
        }
        if (processed + errors.size() >= maxPerRun) {
          break;
        }
      }
    }

    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("processed", processed);
    detail.put("enqueued", enqueued);
    detail.put("skipped", skipped);
    detail.put("errors", errors.size());
    final String message =
        String.format(
            "digests processed=%d enqueued=%d skipped=%d errors=%d",
            processed, enqueued, skipped, errors.size());
    if (errors.isEmpty()) {
      return JobResult.success(message, detail);
    }
    if (processed == 0) {
      return JobResult.failure(message, detail, errors);
    }
    return JobResult.partial(message, detail, errors);
  }

  private int process(ScheduledNotification schedule, Instant now) {
    final Map<String, Object> baseData = parseData(schedule.templateDataJson());
    int count = 0;
    for (UserProfile recipient : resolveRecipients(schedule)) {
      if (!recipient.isOptedIn(schedule.channel())) {
        continue;
      }
      final Map<String, Object> data = new HashMap<>(baseData);
      data.put("user", UserDisplay.of(recipient));
      if (queueService
          .enqueue(recipient.identifier(), schedule.channel(), schedule.trigger(), data)
          .isPresent()) {
        count++;
      }
    }
    scheduleRepository.markSent(schedule.scheduleId(), now);
    logger.info(
        "scheduled notification enqueued scheduleId={} trigger={} recipients={}",
        schedule.scheduleId(),
        schedule.trigger(),
        count);
    return count;
  }

  private List<UserProfile> resolveRecipients(ScheduledNotification schedule) {
    if (schedule.recipientScope() == RecipientScope.OWNER) {
      return userProfileLookup.resolve(schedule.owner()).map(List::of).orElseGet(List::of);
    }
    final Integer requested = schedule.maxRecipients();
    final int limit =
        requested == null || requested <= 0 ? MAX_RECIPIENTS_CAP : Math.min(requested, MAX_RECIPIENTS_CAP);
    return userProfileLookup.findRecipients(schedule.recipientScope(), limit);
  }

  private Map<String, Object> parseData(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      final Map<String, Object> data = objectMapper.readValue(json, DATA_TYPE);
      return data == null ? Map.of() : data;
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("malformed template data", ex);
    }
  }
}
