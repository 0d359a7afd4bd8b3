package com.example.matrimony.pipeline.event;

public record MessageReceivedEvent(String senderId, String recipientId, String messagePreview) {}
