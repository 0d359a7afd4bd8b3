/*
 * Where: pipeline domain model
 * What: administrator override of a scheduled notification's recurrence
 * Why: moderation can reschedule or silence a digest without touching the owner's setting
 */
package com.example.matrimony.pipeline.model;

import java.time.Instant;

public record AdminOverride(
    Recurrence recurrence,
    boolean disabled,
    String reason,
    String overriddenBy,
    Instant overriddenAt) {}
