package com.example.matrimony.pipeline.model;

public enum JobExecutionStatus {
  RUNNING,
  SUCCESS,
  FAILURE,
  PARTIAL
}
