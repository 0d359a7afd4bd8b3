/*
 * Where: pipeline domain model
 * What: the user collaborator's view of a member
 * Why: delivery needs addresses and opt-ins, events need display names
 */
package com.example.matrimony.pipeline.model;

public record UserProfile(
    String identifier,
    String firstName,
    String lastName,
    String email,
    String phone,
    String pushToken,
    NotificationChannel preferredChannel,
    boolean emailOptIn,
    boolean smsOptIn,
    boolean pushOptIn,
    boolean active) {

  public boolean isOptedIn(NotificationChannel channel) {
    return switch (channel) {
      case EMAIL -> emailOptIn;
      case SMS -> smsOptIn;
      case PUSH -> pushOptIn;
    };
  }

  /** Returns the delivery address for the channel, or {@code null} when none is on file. */
  public String addressFor(NotificationChannel channel) {
    final String address =
        switch (channel) {
          case EMAIL -> email;
          case SMS -> phone;
          case PUSH -> pushToken;
        };
    return address == null || address.isBlank() ? null : address;
  }

  public String fullName() {
    final String first = firstName == null ? "" : firstName.trim();
    final String last = lastName == null ? "" : lastName.trim();
    return (first + " " + last).trim();
  }
}
