package com.example.matrimony.pipeline.job;

public class JobNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public JobNotFoundException(String name) {
    super("job not found: " + name);
  }
}
