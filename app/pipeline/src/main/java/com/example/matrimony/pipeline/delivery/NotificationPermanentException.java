/*
 * Where: pipeline delivery
 * What: a notification that cannot succeed on retry (bad template data, no template, no address)
 */
package com.example.matrimony.pipeline.delivery;

public class NotificationPermanentException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public NotificationPermanentException(String message) {
    super(message);
  }

  public NotificationPermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
