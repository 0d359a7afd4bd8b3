/*
 * Where: pipeline channel boundary
 * What: delivers one rendered message to one address on one channel
 * Why: provider wire formats stay behind this interface
 */
package com.example.matrimony.pipeline.channel;

import com.example.matrimony.pipeline.model.NotificationChannel;

public interface ChannelSender {

  NotificationChannel channel();

  /**
   * Sends the message. Provider rejections are reported through {@link SendResult#failed}; a thrown
   * runtime exception is treated the same way as a transient failure.
   */
  SendResult send(String address, String subject, String body);
}
