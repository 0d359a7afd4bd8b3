/*
 * Where: pipeline channel layer
 * What: channel to sender lookup built once at startup
 * Why: a missing or duplicated channel is a wiring error and fails the context
 */
package com.example.matrimony.pipeline.channel;

import com.example.matrimony.pipeline.config.DeliveryProperties;
import com.example.matrimony.pipeline.model.NotificationChannel;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ChannelSenderRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ChannelSenderRegistry.class);

  private final Map<NotificationChannel, ChannelSender> senders =
      new EnumMap<>(NotificationChannel.class);

  public ChannelSenderRegistry(List<ChannelSender> channelSenders, DeliveryProperties properties) {
    final DeliveryProperties.FailureInjection injection = properties.failureInjection();
    for (ChannelSender sender : channelSenders) {
      final ChannelSender registered =
          injection != null && injection.enabled()
              ? new FailureInjectingChannelSender(
                  sender, injection.recipientPrefix(), injection.errorMessage())
              : sender;
      final ChannelSender previous = senders.putIfAbsent(sender.channel(), registered);
      if (previous != null) {
        throw new IllegalStateException("duplicate sender for channel " + sender.channel().value());
      }
    }
    for (NotificationChannel channel : NotificationChannel.values()) {
      if (!senders.containsKey(channel)) {
        throw new IllegalStateException("no sender registered for channel " + channel.value());
      }
    }
    if (injection != null && injection.enabled()) {
      logger.warn("channel failure injection enabled recipientPrefix={}", injection.recipientPrefix());
    }
  }

  public ChannelSender forChannel(NotificationChannel channel) {
    return senders.get(channel);
  }
}
