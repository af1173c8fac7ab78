package com.mintflow.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Used when no broker is configured: notifications are written to the log only. */
@Component
@ConditionalOnProperty(prefix = "mintflow.notifications", name = "enabled", havingValue = "false",
    matchIfMissing = true)
public class LoggingNotificationPublisher implements NotificationPublisher {
  private static final Logger log = LoggerFactory.getLogger(LoggingNotificationPublisher.class);

  private final ObjectMapper objectMapper;

  public LoggingNotificationPublisher(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public void publish(String topic, String key, Object payload) {
    try {
      log.info("Notification for {} on {}: {}", key, topic, objectMapper.writeValueAsString(payload));
    } catch (JsonProcessingException ex) {
      throw new NotificationPublishException("Could not serialize notification for " + key, ex);
    }
  }
}
