/*
 * Where: pipeline event dispatch
 * What: turns domain events into queued notifications with display context
 * Why: producers publish facts; which member hears about them, and how, is decided here
 */
package com.example.matrimony.pipeline.event;

import com.example.matrimony.pipeline.delivery.NotificationQueueService;
import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.UserProfile;
import com.example.matrimony.pipeline.template.TemplateRenderer;
import com.example.matrimony.pipeline.user.UserDisplay;
import com.example.matrimony.pipeline.user.UserProfileLookup;
import com.google.common.annotations.VisibleForTesting;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EventDispatcher {

  static final int MESSAGE_PREVIEW_MAX_LENGTH = 100;

  private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

  private final UserProfileLookup userProfileLookup;
  private final NotificationQueueService queueService;

  @EventListener
  public void onUserStatusChanged(UserStatusChangedEvent event) {
    final String trigger = statusTrigger(event.oldStatus(), event.newStatus());
    if (trigger == null) {
      logger.debug(
          "status change needs no notification userId={} status={}",
          event.userId(),
          event.newStatus());
      return;
    }
    final Map<String, Object> extras = new HashMap<>();
    extras.put("reason", event.reason() == null ? "" : event.reason());
    extras.put(
        "newStatus",
        event.newStatus() == null ? "" : event.newStatus().name().toLowerCase(Locale.ROOT));
    safely(trigger, () -> dispatch(trigger, event.userId(), null, extras));
  }

  @EventListener
  public void onFavoriteAdded(FavoriteAddedEvent event) {
    safely(
        NotificationTriggers.FAVORITE_ADDED,
        () -> dispatch(NotificationTriggers.FAVORITE_ADDED, event.targetId(), event.actorId(), Map.of()));
  }

  @EventListener
  public void onMutualFavorite(MutualFavoriteEvent event) {
    safely(
        NotificationTriggers.MUTUAL_FAVORITE,
        () ->
            dispatch(
                NotificationTriggers.MUTUAL_FAVORITE,
                event.firstUserId(),
                event.secondUserId(),
                Map.of()));
    safely(
        NotificationTriggers.MUTUAL_FAVORITE,
        () ->
            dispatch(
                NotificationTriggers.MUTUAL_FAVORITE,
                event.secondUserId(),
                event.firstUserId(),
                Map.of()));
  }

  @EventListener
  public void onShortlistAdded(ShortlistAddedEvent event) {
    safely(
        NotificationTriggers.SHORTLIST_ADDED,
        () -> dispatch(NotificationTriggers.SHORTLIST_ADDED, event.targetId(), event.actorId(), Map.of()));
  }

  @EventListener
  public void onProfileViewed(ProfileViewedEvent event) {
    if (event.viewerId() != null && event.viewerId().equals(event.profileOwnerId())) {
      return;
    }
    safely(
        NotificationTriggers.PROFILE_VIEWED,
        () ->
            dispatch(
                NotificationTriggers.PROFILE_VIEWED,
                event.profileOwnerId(),
                event.viewerId(),
                Map.of()));
  }

  @EventListener
  public void onMessageReceived(MessageReceivedEvent event) {
    final String preview =
        TemplateRenderer.truncate(
            event.messagePreview() == null ? "" : event.messagePreview(), MESSAGE_PREVIEW_MAX_LENGTH);
    safely(
        NotificationTriggers.NEW_MESSAGE,
        () ->
            dispatch(
                NotificationTriggers.NEW_MESSAGE,
                event.recipientId(),
                event.senderId(),
                Map.of("messagePreview", preview)));
  }

  @EventListener
  public void onContactInfoRequested(ContactInfoRequestedEvent event) {
    safely(
        NotificationTriggers.PII_REQUEST,
        () ->
            dispatch(
                NotificationTriggers.PII_REQUEST,
                event.ownerId(),
                event.requesterId(),
                Map.of("fieldName", fieldName(event.fieldName()))));
  }

  @EventListener
  public void onContactInfoGranted(ContactInfoGrantedEvent event) {
    safely(
        NotificationTriggers.PII_GRANTED,
        () ->
            dispatch(
                NotificationTriggers.PII_GRANTED,
                event.requesterId(),
                event.ownerId(),
                Map.of("fieldName", fieldName(event.fieldName()))));
  }

  /**
   * Enqueues the trigger for the recipient on every channel the recipient is opted into.
   *
   * @return the number of notifications enqueued, excluding those the delivery policy suppressed
   */
  @VisibleForTesting
  int dispatch(String trigger, String recipientId, String actorId, Map<String, Object> extras) {
    final Optional<UserProfile> recipient = userProfileLookup.resolve(recipientId);
    if (recipient.isEmpty()) {
      logger.warn("notification dropped; recipient not found trigger={} recipient={}", trigger, recipientId);
      return 0;
    }
    final Map<String, Object> templateData = new HashMap<>(extras);
    templateData.put("user", UserDisplay.of(recipient.get()));
    if (actorId != null) {
      templateData.put(
          "actor",
          userProfileLookup.resolve(actorId).map(UserDisplay::of).orElseGet(UserDisplay::unknown));
    }
    int enqueued = 0;
    for (NotificationChannel channel : NotificationTriggers.channelsFor(trigger)) {
      if (!recipient.get().isOptedIn(channel)) {
        logger.debug(
            "channel skipped; recipient opted out trigger={} recipient={} channel={}",
            trigger,
            recipientId,
            channel.value());
        continue;
      }
      if (queueService.enqueue(recipient.get().identifier(), channel, trigger, templateData).isPresent()) {
        enqueued++;
      }
    }
    return enqueued;
  }

  static String statusTrigger(MemberStatus oldStatus, MemberStatus newStatus) {
    if (newStatus == null) {
      return null;
    }
    final boolean wasInactive = oldStatus == MemberStatus.SUSPENDED || oldStatus == MemberStatus.PAUSED;
    return switch (newStatus) {
      case APPROVED, ACTIVE -> {
        if (wasInactive) {
          yield NotificationTriggers.STATUS_REACTIVATED;
        }
        yield newStatus == MemberStatus.APPROVED || oldStatus == MemberStatus.PENDING
            ? NotificationTriggers.STATUS_APPROVED
            : null;
      }
      case PAUSED -> NotificationTriggers.STATUS_PAUSED;
      case SUSPENDED -> NotificationTriggers.STATUS_SUSPENDED;
      case BANNED -> NotificationTriggers.STATUS_BANNED;
      case PENDING -> null;
    };
  }

  private String fieldName(String fieldName) {
    return fieldName == null || fieldName.isBlank() ? "contact details" : fieldName;
  }

  // listeners run on the publisher's thread; a queue failure must not fail the domain action
  private void safely(String trigger, Runnable work) {
    try {
      work.run();
    } catch (RuntimeException ex) {
      logger.error("event dispatch failed trigger={}", trigger, ex);
    }
  }
}
