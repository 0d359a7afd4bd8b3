/*
 * Where: pipeline delivery
 * What: enqueue and batch claim over the notification queue
 * Why: producers enqueue typed bindings; drains read the oldest pending records that are due
 */
package com.example.matrimony.pipeline.delivery;

import com.example.matrimony.pipeline.config.DeliveryProperties;
import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.NotificationRecord;
import com.example.matrimony.pipeline.repository.NotificationQueueRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationQueueService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationQueueService.class);

  private final NotificationQueueRepository queueRepository;
  private final DeliveryPolicy deliveryPolicy;
  private final DeliveryProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Stores a PENDING record unless the delivery policy suppresses it. Records landing in quiet
   * hours are stored with {@code scheduledFor} set to the end of the window.
   *
   * @return the new notification id, or empty when suppressed
   */
  public Optional<UUID> enqueue(
      String recipient, NotificationChannel channel, String trigger, Map<String, ?> templateData) {
    if (recipient == null || recipient.isBlank()) {
      throw new IllegalArgumentException("recipient is required");
    }
    if (trigger == null || trigger.isBlank()) {
      throw new IllegalArgumentException("trigger is required");
    }
    final Instant now = Instant.now(clock);
    final DeliveryDecision decision = deliveryPolicy.evaluate(recipient, channel, trigger, now);
    if (decision.suppressed()) {
      logger.info(
          "notification suppressed recipient={} channel={} trigger={} reason={}",
          recipient,
          channel.value(),
          trigger,
          decision.reason());
      return Optional.empty();
    }
    final NotificationRecord record =
        NotificationRecord.pending(
                recipient,
                channel,
                trigger,
                toJson(templateData),
                properties.defaultMaxAttempts(),
                now)
            .deferredUntil(decision.deferUntil());
    queueRepository.insert(record);
    logger.info(
        "notification enqueued id={} recipient={} channel={} trigger={} scheduledFor={}",
        record.notificationId(),
        recipient,
        channel.value(),
        trigger,
        record.scheduledFor());
    return Optional.of(record.notificationId());
  }

  public List<NotificationRecord> claimBatch(NotificationChannel channel, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    return queueRepository.findPending(channel, limit, Instant.now(clock));
  }

  private String toJson(Map<String, ?> templateData) {
    try {
      return objectMapper.writeValueAsString(templateData == null ? Map.of() : templateData);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("template data is not serializable", ex);
    }
  }
}
