package com.example.matrimony.pipeline.template;

public record RenderedMessage(String subject, String body) {}
