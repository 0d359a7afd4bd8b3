package com.example.matrimony.pipeline.event;

/** Both members favorited each other; each is notified about the other. */
public record MutualFavoriteEvent(String firstUserId, String secondUserId) {}
