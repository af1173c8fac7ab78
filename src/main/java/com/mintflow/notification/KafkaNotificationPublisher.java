package com.mintflow.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mintflow.config.NotificationProperties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "mintflow.notifications", name = "enabled", havingValue = "true")
public class KafkaNotificationPublisher implements NotificationPublisher {
  private static final Logger log = LoggerFactory.getLogger(KafkaNotificationPublisher.class);

  private final KafkaTemplate<String, String> kafkaTemplate;
  private final ObjectMapper objectMapper;
  private final NotificationProperties properties;

  public KafkaNotificationPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                    ObjectMapper objectMapper,
                                    NotificationProperties properties) {
    this.kafkaTemplate = kafkaTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public void publish(String topic, String key, Object payload) {
    String json;
    try {
      json = objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new NotificationPublishException("Could not serialize notification for " + key, ex);
    }
    try {
      SendResult<String, String> result = kafkaTemplate.send(topic, key, json)
          .get(properties.sendTimeout().toMillis(), TimeUnit.MILLISECONDS);
      log.debug("Published notification to {}-{}@{}", topic,
          result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new NotificationPublishException("Interrupted while publishing to " + topic, ex);
    } catch (ExecutionException | TimeoutException ex) {
      throw new NotificationPublishException("Failed to publish notification to " + topic, ex);
    }
  }
}
