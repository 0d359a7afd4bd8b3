package com.example.matrimony.pipeline.event;

public record ShortlistAddedEvent(String actorId, String targetId) {}
