package com.mintflow.service;

import com.mintflow.config.NotificationProperties;
import com.mintflow.model.BudgetAlert;
import com.mintflow.notification.BudgetAlertNotification;
import com.mintflow.notification.NotificationPublishException;
import com.mintflow.notification.NotificationPublisher;
import com.mintflow.repository.BudgetAlertRepository;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AlertDispatcher {
  private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

  private final NotificationPublisher publisher;
  private final BudgetAlertRepository alertRepository;
  private final NotificationProperties properties;
  private final Clock clock;

  public AlertDispatcher(NotificationPublisher publisher,
                         BudgetAlertRepository alertRepository,
                         NotificationProperties properties,
                         Clock clock) {
    this.publisher = publisher;
    this.alertRepository = alertRepository;
    this.properties = properties;
    this.clock = clock;
  }

  public boolean dispatch(BudgetAlert alert) {
    try {
      publisher.publish(properties.topic(), alert.getUserId().toString(), BudgetAlertNotification.of(alert));
    } catch (NotificationPublishException ex) {
      log.warn("Could not deliver budget alert {} for user {}: {}", alert.getId(), alert.getUserId(), ex.getMessage());
      return false;
    }
    alert.setSentAt(clock.instant());
    alertRepository.save(alert);
    return true;
  }
}
