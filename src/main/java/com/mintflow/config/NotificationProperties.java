package com.mintflow.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mintflow.notifications")
public record NotificationProperties(boolean enabled, String topic, Duration sendTimeout) {
  public NotificationProperties {
    if (topic == null || topic.isBlank()) {
      topic = "notifications";
    }
    if (sendTimeout == null) {
      sendTimeout = Duration.ofSeconds(10);
    }
  }
}
