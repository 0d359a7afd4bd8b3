package com.example.matrimony.pipeline.event;

/** A member asked to see another member's contact detail ({@code fieldName}, e.g. phone). */
public record ContactInfoRequestedEvent(String requesterId, String ownerId, String fieldName) {}
