/*
 * Where: pipeline channel layer
 * What: decorator that fails sends to addresses with a configured prefix
 * Why: exercises retry, opt-out and exhaustion paths end to end without a real provider
 */
package com.example.matrimony.pipeline.channel;

import com.example.matrimony.pipeline.model.NotificationChannel;

public class FailureInjectingChannelSender implements ChannelSender {

  private final ChannelSender delegate;
  private final String recipientPrefix;
  private final String errorMessage;

  public FailureInjectingChannelSender(
      ChannelSender delegate, String recipientPrefix, String errorMessage) {
    this.delegate = delegate;
    this.recipientPrefix = recipientPrefix;
    this.errorMessage = errorMessage;
  }

  @Override
  public NotificationChannel channel() {
    return delegate.channel();
  }

  @Override
  public SendResult send(String address, String subject, String body) {
    if (shouldInjectFailure(address)) {
      return SendResult.failed(errorMessage);
    }
    return delegate.send(address, subject, body);
  }

  private boolean shouldInjectFailure(String address) {
    if (recipientPrefix == null || recipientPrefix.isBlank() || address == null) {
      return false;
    }
    return address.startsWith(recipientPrefix);
  }
}
