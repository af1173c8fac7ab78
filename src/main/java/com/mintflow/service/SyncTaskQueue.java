package com.mintflow.service;

import com.mintflow.config.SyncProperties;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
public class SyncTaskQueue {
  private static final Logger log = LoggerFactory.getLogger(SyncTaskQueue.class);

  private final SyncOrchestrator orchestrator;
  private final BudgetAlertService budgetAlertService;
  private final TaskExecutor dispatch;
  private final TaskScheduler timer;
  private final SyncProperties properties;
  private final Clock clock;

  public SyncTaskQueue(SyncOrchestrator orchestrator,
                       BudgetAlertService budgetAlertService,
                       @Qualifier("syncDispatch") TaskExecutor dispatch,
                       @Qualifier("syncTimer") TaskScheduler timer,
                       SyncProperties properties,
                       Clock clock) {
    this.orchestrator = orchestrator;
    this.budgetAlertService = budgetAlertService;
    this.dispatch = dispatch;
    this.timer = timer;
    this.properties = properties;
    this.clock = clock;
  }

  public void submit(UUID connectionId, boolean force) {
    enqueue(connectionId, force, 1);
  }

  private void enqueue(UUID connectionId, boolean force, int attempt) {
    dispatch.execute(() -> runAttempt(connectionId, force, attempt));
  }

  SyncOutcome runAttempt(UUID connectionId, boolean force, int attempt) {
    SyncOutcome outcome;
    try {
      outcome = orchestrator.sync(connectionId, force);
    } catch (RuntimeException ex) {
      log.error("Sync of connection {} crashed on attempt {}", connectionId, attempt, ex);
      return null;
    }
    if (outcome.isSuccess()) {
      runBudgetPass(outcome);
    } else if (outcome.isRetryable()) {
      if (attempt < properties.maxAttempts()) {
        Duration delay = retryDelay(attempt);
        log.info("Retrying sync of connection {} in {} (attempt {} of {}): {}",
            connectionId, delay, attempt + 1, properties.maxAttempts(), outcome.message());
        timer.schedule(() -> enqueue(connectionId, true, attempt + 1), clock.instant().plus(delay));
      } else {
        log.warn("Giving up on sync of connection {} after {} attempts: {}",
            connectionId, attempt, outcome.message());
      }
    } else if (outcome.status() == SyncOutcome.Status.SKIPPED) {
      log.debug("Sync of connection {} skipped: {}", connectionId, outcome.reason());
    }
    return outcome;
  }

  Duration retryDelay(int attempt) {
    return properties.retryBackoff().multipliedBy(1L << Math.min(attempt - 1, 10));
  }

  private void runBudgetPass(SyncOutcome outcome) {
    try {
      budgetAlertService.run(outcome.userId());
    } catch (RuntimeException ex) {
      log.error("Budget alert pass failed for user {}", outcome.userId(), ex);
    }
  }
}
