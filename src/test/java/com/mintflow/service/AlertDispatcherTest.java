package com.mintflow.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.mintflow.config.NotificationProperties;
import com.mintflow.model.BudgetAlert;
import com.mintflow.model.BudgetAlertType;
import com.mintflow.notification.BudgetAlertNotification;
import com.mintflow.notification.NotificationPublishException;
import com.mintflow.notification.NotificationPublisher;
import com.mintflow.repository.BudgetAlertRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class AlertDispatcherTest {
  private static final Instant NOW = Instant.parse("2026-03-18T12:00:00Z");

  @Mock
  private NotificationPublisher publisher;

  @Mock
  private BudgetAlertRepository alertRepository;

  private AlertDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    dispatcher = new AlertDispatcher(publisher, alertRepository,
        new NotificationProperties(true, "notifications", Duration.ofSeconds(1)),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void publishesAlertKeyedByUserAndMarksItSent() {
    BudgetAlert alert = alert();

    boolean sent = dispatcher.dispatch(alert);

    assertThat(sent).isTrue();
    ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
    verify(publisher).publish(eq("notifications"), eq(alert.getUserId().toString()), payload.capture());
    BudgetAlertNotification notification = (BudgetAlertNotification) payload.getValue();
    assertThat(notification.type()).isEqualTo("budget_alert");
    assertThat(notification.threshold()).isEqualTo(80);
    assertThat(notification.category()).isEqualTo("Food & Dining");
    assertThat(notification.spentAmount()).isEqualByComparingTo("85.00");
    assertThat(notification.budgetAmount()).isEqualByComparingTo("100.00");
    assertThat(alert.getSentAt()).isEqualTo(NOW);
    verify(alertRepository).save(alert);
  }

  @Test
  void failedPublishLeavesAlertUnsent() {
    BudgetAlert alert = alert();
    doThrow(new NotificationPublishException("broker down", null))
        .when(publisher).publish(anyString(), anyString(), any());

    boolean sent = dispatcher.dispatch(alert);

    assertThat(sent).isFalse();
    assertThat(alert.getSentAt()).isNull();
    verify(alertRepository, never()).save(any());
  }

  private BudgetAlert alert() {
    BudgetAlert alert = new BudgetAlert();
    alert.setId(UUID.randomUUID());
    alert.setBudgetId(UUID.randomUUID());
    alert.setUserId(UUID.randomUUID());
    alert.setThreshold(80);
    alert.setAlertType(BudgetAlertType.WARNING);
    alert.setPeriodStart(LocalDate.of(2026, 3, 1));
    alert.setCategory("Food & Dining");
    alert.setBudgetName("Eating out");
    alert.setSpentAmount(new BigDecimal("85.00"));
    alert.setBudgetAmount(new BigDecimal("100.00"));
    alert.setFiredAt(NOW);
    return alert;
  }
}
