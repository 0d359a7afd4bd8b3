/*
 * Where: user data collaborator boundary
 * What: resolves members, lists digest recipients and revokes channel opt-ins
 * Why: the pipeline never owns user data; it only reads it and syncs opt-outs back
 */
package com.example.matrimony.pipeline.user;

import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.RecipientScope;
import com.example.matrimony.pipeline.model.UserProfile;
import java.util.List;
import java.util.Optional;

public interface UserProfileLookup {

  Optional<UserProfile> resolve(String identifier);

  /**
   * Sets the member's opt-in for the channel to false.
   *
   * @return {@code true} when a preference was changed, {@code false} when the member was already
   *     opted out or is unknown
   */
  boolean disableChannel(String identifier, NotificationChannel channel);

  /** Recipients for a non-owner scope, ordered by identifier and capped at {@code limit}. */
  List<UserProfile> findRecipients(RecipientScope scope, int limit);
}
