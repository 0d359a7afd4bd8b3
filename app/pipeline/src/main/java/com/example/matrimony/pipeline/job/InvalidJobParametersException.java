package com.example.matrimony.pipeline.job;

public class InvalidJobParametersException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public InvalidJobParametersException(String message) {
    super(message);
  }

  public InvalidJobParametersException(String message, Throwable cause) {
    super(message, cause);
  }
}
