package com.example.matrimony.pipeline.event;

public record FavoriteAddedEvent(String actorId, String targetId) {}
