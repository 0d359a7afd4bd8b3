/*
 * Where: pipeline delivery
 * What: revokes a member's channel opt-in after a provider opt-out response
 * Why: the preference store must agree with what the provider already enforces
 */
package com.example.matrimony.pipeline.delivery;

import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.UserProfile;
import com.example.matrimony.pipeline.user.UserProfileLookup;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class OptOutSynchronizer {

  private static final Logger logger = LoggerFactory.getLogger(OptOutSynchronizer.class);

  private final UserProfileLookup userProfileLookup;
  private final PipelineMetrics metrics;

  /** Returns {@code true} only when this call changed the stored preference. */
  public boolean synchronize(String recipient, NotificationChannel channel) {
    final Optional<UserProfile> profile = userProfileLookup.resolve(recipient);
    if (profile.isEmpty()) {
      logger.warn("opt-out sync skipped; unknown recipient={} channel={}", recipient, channel.value());
      return false;
    }
    if (!profile.get().isOptedIn(channel)) {
      logger.debug("opt-out already recorded recipient={} channel={}", recipient, channel.value());
      return false;
    }
    final boolean changed = userProfileLookup.disableChannel(recipient, channel);
    if (changed) {
      metrics.recordOptOutSync(channel);
      logger.info("channel opt-in revoked recipient={} channel={}", recipient, channel.value());
    }
    return changed;
  }
}
