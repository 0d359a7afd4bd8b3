/*
 * Where: pipeline domain model
 * What: delivery channels and their stored names
 */
package com.example.matrimony.pipeline.model;

import java.util.Locale;

public enum NotificationChannel {
  EMAIL("email"),
  SMS("sms"),
  PUSH("push");

  private final String value;

  NotificationChannel(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static NotificationChannel fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("channel is required");
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (NotificationChannel channel : values()) {
      if (channel.value.equals(normalized)) {
        return channel;
      }
    }
    throw new IllegalArgumentException("unsupported channel: " + value);
  }
}
