/*
 * Where: pipeline event dispatch test
 * What: recipient selection, display context and status trigger mapping
 * Why: every recipient must see their own name, never the one of whoever triggered the event
 */
package com.example.matrimony.pipeline.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.matrimony.pipeline.delivery.NotificationQueueService;
import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.UserProfile;
import com.example.matrimony.pipeline.template.TemplateRenderer;
import com.example.matrimony.pipeline.user.UserProfileLookup;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EventDispatcherTest {

  private static final UserProfile ASHA = profile("u-asha", "Asha", "Rao", true, false);
  private static final UserProfile RAVI = profile("u-ravi", "Ravi", "Kumar", true, false);

  @Mock private UserProfileLookup userProfileLookup;

  @Mock private NotificationQueueService queueService;

  private EventDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    dispatcher = new EventDispatcher(userProfileLookup, queueService);
  }

  @Test
  void mutualFavoriteNotifiesEachMemberByTheirOwnName() {
    when(userProfileLookup.resolve("u-asha")).thenReturn(Optional.of(ASHA));
    when(userProfileLookup.resolve("u-ravi")).thenReturn(Optional.of(RAVI));

    dispatcher.onMutualFavorite(new MutualFavoriteEvent("u-asha", "u-ravi"));

    @SuppressWarnings("unchecked")
    final ArgumentCaptor<Map<String, Object>> data = ArgumentCaptor.forClass(Map.class);
    final ArgumentCaptor<String> recipients = ArgumentCaptor.forClass(String.class);
    verify(queueService, times(2))
        .enqueue(
            recipients.capture(),
            eq(NotificationChannel.EMAIL),
            eq(NotificationTriggers.MUTUAL_FAVORITE),
            data.capture());
    assertThat(recipients.getAllValues()).containsExactly("u-asha", "u-ravi");

    final TemplateRenderer renderer = new TemplateRenderer();
    final String body = "Hi {user.firstName}, you and {actor.fullName} liked each other";
    final List<String> rendered =
        data.getAllValues().stream().map(bindings -> renderer.render(body, bindings)).toList();
    assertThat(rendered)
        .containsExactly(
            "Hi Asha, you and Ravi Kumar liked each other",
            "Hi Ravi, you and Asha Rao liked each other");
  }

  @Test
  void favoriteIsSentOnlyOnOptedInChannels() {
    final UserProfile pushOnly = profile("u-meera", "Meera", "Iyer", false, true);
    when(userProfileLookup.resolve("u-meera")).thenReturn(Optional.of(pushOnly));
    when(userProfileLookup.resolve("u-ravi")).thenReturn(Optional.of(RAVI));
    when(queueService.enqueue(anyString(), any(), anyString(), anyMap()))
        .thenReturn(Optional.of(UUID.randomUUID()));

    final int enqueued =
        dispatcher.dispatch(NotificationTriggers.FAVORITE_ADDED, "u-meera", "u-ravi", Map.of());

    assertThat(enqueued).isEqualTo(1);
    verify(queueService)
        .enqueue(eq("u-meera"), eq(NotificationChannel.PUSH), eq(NotificationTriggers.FAVORITE_ADDED), anyMap());
  }

  @Test
  void suppressedChannelsAreNotCounted() {
    final UserProfile both = profile("u-meera", "Meera", "Iyer", true, true);
    when(userProfileLookup.resolve("u-meera")).thenReturn(Optional.of(both));
    when(userProfileLookup.resolve("u-ravi")).thenReturn(Optional.of(RAVI));
    when(queueService.enqueue(anyString(), any(), anyString(), anyMap()))
        .thenReturn(Optional.of(UUID.randomUUID()), Optional.empty());

    final int enqueued =
        dispatcher.dispatch(NotificationTriggers.FAVORITE_ADDED, "u-meera", "u-ravi", Map.of());

    assertThat(enqueued).isEqualTo(1);
    verify(queueService, times(2)).enqueue(eq("u-meera"), any(), eq(NotificationTriggers.FAVORITE_ADDED), anyMap());
  }

  @Test
  void unresolvableActorIsShownAsSomeone() {
    when(userProfileLookup.resolve("u-asha")).thenReturn(Optional.of(ASHA));
    when(userProfileLookup.resolve("u-deleted")).thenReturn(Optional.empty());

    dispatcher.onShortlistAdded(new ShortlistAddedEvent("u-deleted", "u-asha"));

    @SuppressWarnings("unchecked")
    final ArgumentCaptor<Map<String, Object>> data = ArgumentCaptor.forClass(Map.class);
    verify(queueService)
        .enqueue(eq("u-asha"), eq(NotificationChannel.EMAIL), eq(NotificationTriggers.SHORTLIST_ADDED), data.capture());
    assertThat(new TemplateRenderer().render("{actor.firstName} shortlisted you", data.getValue()))
        .isEqualTo("Someone shortlisted you");
  }

  @Test
  void unknownRecipientEnqueuesNothing() {
    when(userProfileLookup.resolve("u-gone")).thenReturn(Optional.empty());

    assertThat(dispatcher.dispatch(NotificationTriggers.PII_REQUEST, "u-gone", null, Map.of())).isZero();
    verifyNoInteractions(queueService);
  }

  @Test
  void selfProfileViewIsIgnored() {
    dispatcher.onProfileViewed(new ProfileViewedEvent("u-asha", "u-asha"));

    verifyNoInteractions(userProfileLookup);
    verifyNoInteractions(queueService);
  }

  @Test
  void messagePreviewIsTruncated() {
    when(userProfileLookup.resolve("u-asha")).thenReturn(Optional.of(ASHA));
    when(userProfileLookup.resolve("u-ravi")).thenReturn(Optional.of(RAVI));

    dispatcher.onMessageReceived(new MessageReceivedEvent("u-ravi", "u-asha", "x".repeat(250)));

    @SuppressWarnings("unchecked")
    final ArgumentCaptor<Map<String, Object>> data = ArgumentCaptor.forClass(Map.class);
    verify(queueService)
        .enqueue(eq("u-asha"), eq(NotificationChannel.EMAIL), eq(NotificationTriggers.NEW_MESSAGE), data.capture());
    assertThat((String) data.getValue().get("messagePreview"))
        .hasSize(EventDispatcher.MESSAGE_PREVIEW_MAX_LENGTH)
        .endsWith("...");
  }

  @Test
  void queueFailureDoesNotEscapeTheListener() {
    when(userProfileLookup.resolve("u-asha")).thenReturn(Optional.of(ASHA));
    when(queueService.enqueue(anyString(), any(), anyString(), anyMap()))
        .thenThrow(new IllegalStateException("database down"));

    dispatcher.onUserStatusChanged(
        new UserStatusChangedEvent("u-asha", MemberStatus.ACTIVE, MemberStatus.SUSPENDED, "reports", "admin-1"));

    verify(queueService)
        .enqueue(eq("u-asha"), eq(NotificationChannel.EMAIL), eq(NotificationTriggers.STATUS_SUSPENDED), anyMap());
  }

  @Test
  void statusTriggerDistinguishesApprovalFromReactivation() {
    assertThat(EventDispatcher.statusTrigger(MemberStatus.PENDING, MemberStatus.APPROVED))
        .isEqualTo(NotificationTriggers.STATUS_APPROVED);
    assertThat(EventDispatcher.statusTrigger(MemberStatus.PENDING, MemberStatus.ACTIVE))
        .isEqualTo(NotificationTriggers.STATUS_APPROVED);
    assertThat(EventDispatcher.statusTrigger(MemberStatus.SUSPENDED, MemberStatus.ACTIVE))
        .isEqualTo(NotificationTriggers.STATUS_REACTIVATED);
    assertThat(EventDispatcher.statusTrigger(MemberStatus.PAUSED, MemberStatus.APPROVED))
        .isEqualTo(NotificationTriggers.STATUS_REACTIVATED);
    assertThat(EventDispatcher.statusTrigger(MemberStatus.APPROVED, MemberStatus.ACTIVE)).isNull();
    assertThat(EventDispatcher.statusTrigger(MemberStatus.ACTIVE, MemberStatus.BANNED))
        .isEqualTo(NotificationTriggers.STATUS_BANNED);
    assertThat(EventDispatcher.statusTrigger(MemberStatus.ACTIVE, MemberStatus.PENDING)).isNull();
  }

  private static UserProfile profile(
      String id, String firstName, String lastName, boolean emailOptIn, boolean pushOptIn) {
    return new UserProfile(
        id,
        firstName,
        lastName,
        id + "@example.com",
        null,
        pushOptIn ? "token-" + id : null,
        NotificationChannel.EMAIL,
        emailOptIn,
        false,
        pushOptIn,
        true);
  }
}
