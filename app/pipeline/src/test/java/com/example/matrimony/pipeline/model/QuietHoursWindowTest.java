/*
 * Where: pipeline domain model test
 * What: same-day and overnight quiet windows and where they release
 */
package com.example.matrimony.pipeline.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class QuietHoursWindowTest {

  private static final ZoneId UTC = ZoneId.of("UTC");
  private static final QuietHoursWindow OVERNIGHT =
      new QuietHoursWindow(true, LocalTime.of(22, 0), LocalTime.of(8, 0), UTC);

  @ParameterizedTest
  @CsvSource({
    "2026-01-17T23:30:00Z, 2026-01-18T08:00:00Z",
    "2026-01-17T22:00:00Z, 2026-01-18T08:00:00Z",
    "2026-01-18T03:00:00Z, 2026-01-18T08:00:00Z"
  })
  void overnightWindowReleasesAtTheNextEnd(String now, String release) {
    assertThat(OVERNIGHT.releaseAfter(Instant.parse(now))).contains(Instant.parse(release));
  }

  @ParameterizedTest
  @CsvSource({"2026-01-17T08:00:00Z", "2026-01-17T12:00:00Z", "2026-01-17T21:59:59Z"})
  void outsideTheWindowNothingIsHeldBack(String now) {
    assertThat(OVERNIGHT.releaseAfter(Instant.parse(now))).isEmpty();
  }

  @Test
  void sameDayWindowUsesTheRecipientZone() {
    final QuietHoursWindow afternoon =
        new QuietHoursWindow(true, LocalTime.of(13, 0), LocalTime.of(15, 0), ZoneId.of("Asia/Kolkata"));

    // 08:00Z is 13:30 in Kolkata
    assertThat(afternoon.releaseAfter(Instant.parse("2026-01-17T08:00:00Z")))
        .contains(Instant.parse("2026-01-17T09:30:00Z"));
    assertThat(afternoon.releaseAfter(Instant.parse("2026-01-17T10:00:00Z"))).isEmpty();
  }

  @Test
  void disabledOrEmptyWindowNeverDefers() {
    final Instant midnight = Instant.parse("2026-01-17T00:00:00Z");

    assertThat(QuietHoursWindow.disabled().releaseAfter(midnight)).isEmpty();
    assertThat(new QuietHoursWindow(false, LocalTime.of(22, 0), LocalTime.of(8, 0), UTC).releaseAfter(midnight))
        .isEmpty();
    assertThat(new QuietHoursWindow(true, LocalTime.NOON, LocalTime.NOON, UTC).releaseAfter(midnight))
        .isEmpty();
  }
}
