package com.example.matrimony.pipeline.event;

public enum MemberStatus {
  PENDING,
  APPROVED,
  ACTIVE,
  PAUSED,
  SUSPENDED,
  BANNED
}
