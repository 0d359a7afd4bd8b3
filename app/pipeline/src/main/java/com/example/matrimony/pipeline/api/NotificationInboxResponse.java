package com.example.matrimony.pipeline.api;

import java.util.List;

public record NotificationInboxResponse(String recipient, List<NotificationSummary> notifications) {}
