/*
 * Where: pipeline event dispatch
 * What: trigger names, the channels each trigger is delivered on and its priority
 */
package com.example.matrimony.pipeline.event;

import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.NotificationPriority;
import java.util.List;
import java.util.Map;

public final class NotificationTriggers {

  public static final String STATUS_APPROVED = "status_approved";
  public static final String STATUS_REACTIVATED = "status_reactivated";
  public static final String STATUS_PAUSED = "status_paused";
  public static final String STATUS_SUSPENDED = "status_suspended";
  public static final String STATUS_BANNED = "status_banned";
  public static final String FAVORITE_ADDED = "favorite_added";
  public static final String MUTUAL_FAVORITE = "mutual_favorite";
  public static final String SHORTLIST_ADDED = "shortlist_added";
  public static final String PROFILE_VIEWED = "profile_viewed";
  public static final String NEW_MESSAGE = "new_message";
  public static final String PII_REQUEST = "pii_request";
  public static final String PII_GRANTED = "pii_granted";

  private static final List<NotificationChannel> EMAIL_ONLY = List.of(NotificationChannel.EMAIL);
  private static final List<NotificationChannel> EMAIL_AND_PUSH =
      List.of(NotificationChannel.EMAIL, NotificationChannel.PUSH);

  private static final Map<String, List<NotificationChannel>> CHANNELS =
      Map.ofEntries(
          Map.entry(STATUS_APPROVED, List.of(NotificationChannel.EMAIL, NotificationChannel.SMS)),
          Map.entry(STATUS_REACTIVATED, EMAIL_ONLY),
          Map.entry(STATUS_PAUSED, EMAIL_ONLY),
          Map.entry(STATUS_SUSPENDED, EMAIL_ONLY),
          Map.entry(STATUS_BANNED, EMAIL_ONLY),
          Map.entry(FAVORITE_ADDED, EMAIL_AND_PUSH),
          Map.entry(MUTUAL_FAVORITE, EMAIL_AND_PUSH),
          Map.entry(SHORTLIST_ADDED, EMAIL_ONLY),
          Map.entry(PROFILE_VIEWED, List.of(NotificationChannel.PUSH)),
          Map.entry(NEW_MESSAGE, List.of(NotificationChannel.PUSH, NotificationChannel.EMAIL)),
          Map.entry(PII_REQUEST, EMAIL_ONLY),
          Map.entry(PII_GRANTED, EMAIL_ONLY));

  private static final Map<String, NotificationPriority> PRIORITIES =
      Map.ofEntries(
          Map.entry(STATUS_APPROVED, NotificationPriority.CRITICAL),
          Map.entry(STATUS_REACTIVATED, NotificationPriority.CRITICAL),
          Map.entry(STATUS_PAUSED, NotificationPriority.CRITICAL),
          Map.entry(STATUS_SUSPENDED, NotificationPriority.CRITICAL),
          Map.entry(STATUS_BANNED, NotificationPriority.CRITICAL),
          Map.entry(NEW_MESSAGE, NotificationPriority.HIGH),
          Map.entry(PII_REQUEST, NotificationPriority.HIGH),
          Map.entry(PII_GRANTED, NotificationPriority.HIGH),
          Map.entry(MUTUAL_FAVORITE, NotificationPriority.HIGH),
          Map.entry(PROFILE_VIEWED, NotificationPriority.LOW));

  private NotificationTriggers() {}

  public static List<NotificationChannel> channelsFor(String trigger) {
    return CHANNELS.getOrDefault(trigger, List.of());
  }

  /** Scheduled digests and other unlisted triggers are MEDIUM. */
  public static NotificationPriority priorityFor(String trigger) {
    return PRIORITIES.getOrDefault(trigger, NotificationPriority.MEDIUM);
  }
}
