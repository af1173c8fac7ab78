package com.mintflow.notification;

public class NotificationPublishException extends RuntimeException {
  public NotificationPublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
