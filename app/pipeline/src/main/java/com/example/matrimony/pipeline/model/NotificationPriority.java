/*
 * Where: pipeline domain model
 * What: delivery urgency of a trigger
 * Why: critical account notices are never held back by quiet hours
 */
package com.example.matrimony.pipeline.model;

public enum NotificationPriority {
  CRITICAL,
  HIGH,
  MEDIUM,
  LOW
}
