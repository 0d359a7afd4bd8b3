/*
 * Where: user data collaborator
 * What: the display map placed under "user"/"actor" in template data
 */
package com.example.matrimony.pipeline.user;

import com.example.matrimony.pipeline.model.UserProfile;
import java.util.LinkedHashMap;
import java.util.Map;

public final class UserDisplay {

  static final String UNKNOWN_NAME = "Someone";

  private UserDisplay() {}

  public static Map<String, Object> of(UserProfile profile) {
    final Map<String, Object> display = new LinkedHashMap<>();
    display.put("firstName", nullToEmpty(profile.firstName()));
    display.put("lastName", nullToEmpty(profile.lastName()));
    display.put("fullName", profile.fullName());
    display.put("username", profile.identifier());
    return display;
  }

  /** Placeholder display for a member who can no longer be resolved. */
  public static Map<String, Object> unknown() {
    final Map<String, Object> display = new LinkedHashMap<>();
    display.put("firstName", UNKNOWN_NAME);
    display.put("lastName", "");
    display.put("fullName", UNKNOWN_NAME);
    display.put("username", "");
    return display;
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
