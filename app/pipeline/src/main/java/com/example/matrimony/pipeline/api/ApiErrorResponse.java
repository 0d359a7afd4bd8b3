/*
 * Where: pipeline debug API
 * What: standard error body
 */
package com.example.matrimony.pipeline.api;

public record ApiErrorResponse(String code, String message) {}
