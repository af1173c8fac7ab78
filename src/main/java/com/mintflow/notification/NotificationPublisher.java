package com.mintflow.notification;

public interface NotificationPublisher {
  void publish(String topic, String key, Object payload);
}
