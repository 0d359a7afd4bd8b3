package com.example.matrimony.pipeline.event;

/** Published by moderation when a member's account status changes. */
public record UserStatusChangedEvent(
    String userId, MemberStatus oldStatus, MemberStatus newStatus, String reason, String changedBy) {}
