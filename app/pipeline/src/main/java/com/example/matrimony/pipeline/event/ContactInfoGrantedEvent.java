package com.example.matrimony.pipeline.event;

public record ContactInfoGrantedEvent(String ownerId, String requesterId, String fieldName) {}
