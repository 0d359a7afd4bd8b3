/*
 * Where: pipeline domain model
 * What: snapshot of a notification_queue row
 * Why: shared by the queue, the drain templates and the debug API
 */
package com.example.matrimony.pipeline.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
        UUID notificationId,
        String recipient,
        NotificationChannel channel,
        String trigger,
        String templateDataJson,
        NotificationStatus status,
        int attempts,
        int maxAttempts,
        String lastError,
        Instant createdAt,
        Instant updatedAt,
        Instant sentAt,
        Instant scheduledFor) {

    public static NotificationRecord pending(
            String recipient,
            NotificationChannel channel,
            String trigger,
            String templateDataJson,
            int maxAttempts,
            Instant now) {
        return new NotificationRecord(
                UUID.randomUUID(),
                recipient,
                channel,
                trigger,
                templateDataJson,
                NotificationStatus.PENDING,
                0,
                maxAttempts,
                null,
                now,
                now,
                null,
                null);
    }

    /** Copy held back from drains until {@code instant}; {@code null} keeps it immediately claimable. */
    public NotificationRecord deferredUntil(Instant instant) {
        return new NotificationRecord(
                notificationId,
                recipient,
                channel,
                trigger,
                templateDataJson,
                status,
                attempts,
                maxAttempts,
                lastError,
                createdAt,
                updatedAt,
                sentAt,
                instant);
    }
}
