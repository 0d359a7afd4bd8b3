/*
 * Where: pipeline delivery unit test
 * What: provider opt-out responses revoke the stored opt-in exactly once
 */
package com.example.matrimony.pipeline.delivery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.UserProfile;
import com.example.matrimony.pipeline.user.UserProfileLookup;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OptOutSynchronizerTest {

  private static final String RECIPIENT = "u-ravi";

  @Mock private UserProfileLookup userProfileLookup;

  @Mock private PipelineMetrics metrics;

  @Test
  void secondOptOutForTheSameChannelWritesNothing() {
    when(userProfileLookup.resolve(RECIPIENT))
        .thenReturn(Optional.of(profile(true)))
        .thenReturn(Optional.of(profile(false)));
    when(userProfileLookup.disableChannel(RECIPIENT, NotificationChannel.SMS)).thenReturn(true);
    final OptOutSynchronizer synchronizer = new OptOutSynchronizer(userProfileLookup, metrics);

    assertThat(synchronizer.synchronize(RECIPIENT, NotificationChannel.SMS)).isTrue();
    assertThat(synchronizer.synchronize(RECIPIENT, NotificationChannel.SMS)).isFalse();

    verify(userProfileLookup, times(1)).disableChannel(RECIPIENT, NotificationChannel.SMS);
    verify(metrics, times(1)).recordOptOutSync(NotificationChannel.SMS);
  }

  @Test
  void concurrentRevocationIsNotCountedTwice() {
    // the conditional update reports no change when another worker got there first
    when(userProfileLookup.resolve(RECIPIENT)).thenReturn(Optional.of(profile(true)));
    when(userProfileLookup.disableChannel(RECIPIENT, NotificationChannel.SMS)).thenReturn(false);
    final OptOutSynchronizer synchronizer = new OptOutSynchronizer(userProfileLookup, metrics);

    assertThat(synchronizer.synchronize(RECIPIENT, NotificationChannel.SMS)).isFalse();

    verify(metrics, never()).recordOptOutSync(NotificationChannel.SMS);
  }

  @Test
  void unknownRecipientIsIgnored() {
    when(userProfileLookup.resolve(RECIPIENT)).thenReturn(Optional.empty());
    final OptOutSynchronizer synchronizer = new OptOutSynchronizer(userProfileLookup, metrics);

    assertThat(synchronizer.synchronize(RECIPIENT, NotificationChannel.EMAIL)).isFalse();

    verify(userProfileLookup, never()).disableChannel(RECIPIENT, NotificationChannel.EMAIL);
  }

  private UserProfile profile(boolean smsOptIn) {
    return new UserProfile(
        RECIPIENT,
        "Ravi",
        "Kumar",
        "ravi@example.com",
        "+15550002222",
        null,
        NotificationChannel.SMS,
        true,
        smsOptIn,
        false,
        true);
  }
}
