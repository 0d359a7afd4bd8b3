package com.example.matrimony.pipeline.channel;

public record SendResult(boolean success, String providerMessageId, String errorDetail) {

  public static SendResult sent(String providerMessageId) {
    return new SendResult(true, providerMessageId, null);
  }

  public static SendResult failed(String errorDetail) {
    return new SendResult(false, null, errorDetail == null ? "unknown provider error" : errorDetail);
  }
}
