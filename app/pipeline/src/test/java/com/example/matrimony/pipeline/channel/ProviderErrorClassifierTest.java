package com.example.matrimony.pipeline.channel;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.matrimony.pipeline.channel.ProviderErrorClassifier.FailureKind;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ProviderErrorClassifierTest {

  private final ProviderErrorClassifier classifier = new ProviderErrorClassifier();

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "21610: recipient replied STOP | OPTED_OUT",
        "User has OPT_OUT of marketing | OPTED_OUT",
        "recipient requested unsubscribe | OPTED_OUT",
        "invalid_recipient: bad token | INVALID_RECIPIENT",
        "Invalid number format | INVALID_RECIPIENT",
        "delivery stopped by carrier | TRANSIENT",
        "connection reset | TRANSIENT",
        "send timed out after 10000ms | TRANSIENT"
      })
  void classifiesProviderErrors(String errorDetail, FailureKind expected) {
    assertThat(classifier.classify(errorDetail)).isEqualTo(expected);
  }

  @ParameterizedTest
  @CsvSource(value = {"''", "'   '"})
  void blankErrorsAreTransient(String errorDetail) {
    assertThat(classifier.classify(errorDetail)).isEqualTo(FailureKind.TRANSIENT);
    assertThat(classifier.classify(null)).isEqualTo(FailureKind.TRANSIENT);
  }
}
