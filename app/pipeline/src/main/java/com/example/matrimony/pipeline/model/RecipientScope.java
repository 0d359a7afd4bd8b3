package com.example.matrimony.pipeline.model;

public enum RecipientScope {
  OWNER,
  ACTIVE_USERS,
  ALL_USERS
}
