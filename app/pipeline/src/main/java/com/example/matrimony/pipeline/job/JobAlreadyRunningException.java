package com.example.matrimony.pipeline.job;

public class JobAlreadyRunningException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public JobAlreadyRunningException(String name) {
    super("job is already running: " + name);
  }
}
