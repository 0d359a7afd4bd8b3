/*
 * Where: pipeline domain model
 * What: snapshot of a scheduled_notifications row
 * Why: input of the digest processor
 */
package com.example.matrimony.pipeline.model;

import java.time.Instant;
import java.util.UUID;

public record ScheduledNotification(
    UUID scheduleId,
    String owner,
    String trigger,
    NotificationChannel channel,
    RecipientScope recipientScope,
    Integer maxRecipients,
    Recurrence recurrence,
    String templateDataJson,
    boolean enabled,
    Instant lastSentAt,
    AdminOverride adminOverride,
    Instant createdAt) {}
