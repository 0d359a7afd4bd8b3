package com.example.matrimony.pipeline.delivery;

/** Counts of one drain pass; {@code retried} records stay PENDING for the next pass. */
public record DrainSummary(int sent, int failed, int retried) {

  public int total() {
    return sent + failed + retried;
  }
}
