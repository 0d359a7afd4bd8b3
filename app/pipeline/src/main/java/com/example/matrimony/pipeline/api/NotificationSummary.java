/*
 * Where: pipeline debug API model
 * What: one queued notification with its delivery state and bindings
 */
package com.example.matrimony.pipeline.api;

import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.NotificationStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    UUID notificationId,
    NotificationChannel channel,
    String trigger,
    NotificationStatus status,
    int attempts,
    int maxAttempts,
    String lastError,
    Instant createdAt,
    Instant sentAt,
    Instant scheduledFor,
    JsonNode templateData) {}
