package com.example.matrimony.pipeline.event;

public record ProfileViewedEvent(String viewerId, String profileOwnerId) {}
