/*
 * Where: pipeline delivery
 * What: outcome of the delivery policy for one notification about to be enqueued
 */
package com.example.matrimony.pipeline.delivery;

import java.time.Instant;

public record DeliveryDecision(boolean suppressed, Instant deferUntil, String reason) {

  public static DeliveryDecision sendNow() {
    return new DeliveryDecision(false, null, null);
  }

  public static DeliveryDecision defer(Instant until, String reason) {
    return new DeliveryDecision(false, until, reason);
  }

  public static DeliveryDecision suppress(String reason) {
    return new DeliveryDecision(true, null, reason);
  }
}
