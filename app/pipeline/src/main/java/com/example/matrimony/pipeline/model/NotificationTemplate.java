/*
 * Where: pipeline domain model
 * What: subject/body pair registered for a (trigger, channel)
 */
package com.example.matrimony.pipeline.model;

public record NotificationTemplate(
    String trigger,
    NotificationChannel channel,
    String subject,
    String body,
    Integer maxLength,
    boolean enabled) {}
