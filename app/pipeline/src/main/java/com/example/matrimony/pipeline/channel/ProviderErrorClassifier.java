/*
 * Where: pipeline channel layer
 * What: classifies provider error text into opt-out, invalid recipient or transient
 * Why: only transient failures are retried
 */
package com.example.matrimony.pipeline.channel;

import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class ProviderErrorClassifier {

  public enum FailureKind {
    TRANSIENT,
    OPTED_OUT,
    INVALID_RECIPIENT
  }

  private static final List<String> OPT_OUT_MARKERS = List.of("opt_out", "opt-out", "unsubscribe");
  private static final List<String> INVALID_RECIPIENT_MARKERS =
      List.of("invalid_recipient", "invalid number", "invalid address");

  public FailureKind classify(String errorDetail) {
    if (errorDetail == null || errorDetail.isBlank()) {
      return FailureKind.TRANSIENT;
    }
    final String normalized = errorDetail.toLowerCase(Locale.ROOT);
    if (containsAny(normalized, OPT_OUT_MARKERS) || isStopReply(errorDetail)) {
      return FailureKind.OPTED_OUT;
    }
    if (containsAny(normalized, INVALID_RECIPIENT_MARKERS)) {
      return FailureKind.INVALID_RECIPIENT;
    }
    return FailureKind.TRANSIENT;
  }

  private boolean containsAny(String text, List<String> markers) {
    for (String marker : markers) {
      if (text.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  // carriers report STOP in upper case; "stopped"/"non-stop" style words must not match
  private boolean isStopReply(String errorDetail) {
    return errorDetail.matches("(?s).*\\bSTOP\\b.*");
  }
}
