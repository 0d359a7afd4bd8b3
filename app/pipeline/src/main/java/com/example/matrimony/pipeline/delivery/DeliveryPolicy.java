/*
 * Where: pipeline delivery
 * What: recipient channel preferences, per-channel rate limits and quiet hours
 * Why: applied once at enqueue so drains only see records that may go out
 */
package com.example.matrimony.pipeline.delivery;

import com.example.matrimony.pipeline.config.DeliveryPolicyProperties;
import com.example.matrimony.pipeline.event.NotificationTriggers;
import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.NotificationPriority;
import com.example.matrimony.pipeline.model.QuietHoursWindow;
import com.example.matrimony.pipeline.repository.NotificationLogRepository;
import com.example.matrimony.pipeline.repository.NotificationPreferenceRepository;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeliveryPolicy {

  private final NotificationPreferenceRepository preferenceRepository;
  private final NotificationLogRepository logRepository;
  private final DeliveryPolicyProperties properties;

  public DeliveryDecision evaluate(
      String recipient, NotificationChannel channel, String trigger, Instant now) {
    if (!preferenceRepository.isChannelEnabled(recipient, trigger, channel)) {
      return DeliveryDecision.suppress("channel disabled by recipient");
    }

    final DeliveryPolicyProperties.RateLimit limit = properties.rateLimitFor(channel.value());
    if (limit != null) {
      final int sent = logRepository.countSentSince(recipient, channel, now.minus(limit.period()));
      if (sent >= limit.maxCount()) {
        return DeliveryDecision.suppress(
            "rate limit reached: " + sent + " " + channel.value() + " sent within " + limit.period());
      }
    }

    if (NotificationTriggers.priorityFor(trigger) == NotificationPriority.CRITICAL) {
      return DeliveryDecision.sendNow();
    }
    final QuietHoursWindow window =
        preferenceRepository
            .findQuietHours(recipient)
            .orElseGet(() -> properties.quietHours().toWindow());
    final Optional<Instant> release = window.releaseAfter(now);
    return release
        .map(until -> DeliveryDecision.defer(until, "quiet hours"))
        .orElseGet(DeliveryDecision::sendNow);
  }
}
