/*
 * Where: pipeline domain model
 * What: delivery state of a queued notification
 * Why: SENT and FAILED are terminal; only PENDING rows are mutated
 */
package com.example.matrimony.pipeline.model;

public enum NotificationStatus {
    PENDING,
    SENT,
    FAILED
}
