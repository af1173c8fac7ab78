package com.mintflow.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mintflow.config.NotificationProperties;
import com.mintflow.model.BudgetAlertType;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

class KafkaNotificationPublisherTest {
  @Mock
  private KafkaTemplate<String, String> kafkaTemplate;

  private KafkaNotificationPublisher publisher;
  private final UUID userId = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    publisher = new KafkaNotificationPublisher(kafkaTemplate, new ObjectMapper().findAndRegisterModules(),
        new NotificationProperties(true, "notifications", Duration.ofSeconds(1)));
  }

  @Test
  void sendsJsonKeyedByUser() {
    ProducerRecord<String, String> record = new ProducerRecord<>("notifications", userId.toString(), "{}");
    RecordMetadata metadata = new RecordMetadata(new TopicPartition("notifications", 0), 42L, 0, 0L, 36, 2);
    when(kafkaTemplate.send(eq("notifications"), eq(userId.toString()), anyString()))
        .thenReturn(CompletableFuture.completedFuture(new SendResult<>(record, metadata)));

    publisher.publish("notifications", userId.toString(), notification());

    ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
    verify(kafkaTemplate).send(eq("notifications"), eq(userId.toString()), json.capture());
    assertThat(json.getValue())
        .contains("\"type\":\"budget_alert\"")
        .contains("\"threshold\":100")
        .contains("\"category\":\"Groceries\"")
        .contains(userId.toString());
  }

  @Test
  void brokerFailureIsReported() {
    when(kafkaTemplate.send(anyString(), anyString(), anyString()))
        .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("no brokers")));

    assertThatThrownBy(() -> publisher.publish("notifications", userId.toString(), notification()))
        .isInstanceOf(NotificationPublishException.class)
        .hasMessageContaining("notifications");
  }

  private BudgetAlertNotification notification() {
    return new BudgetAlertNotification(userId, BudgetAlertNotification.TYPE, UUID.randomUUID(), 100,
        new BigDecimal("412.80"), new BigDecimal("400.00"), "Groceries", BudgetAlertType.EXCEEDED,
        "Groceries", LocalDate.of(2026, 3, 1));
  }
}
