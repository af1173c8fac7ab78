package com.mintflow.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mintflow.config.SyncProperties;
import com.mintflow.model.ConnectionErrorCode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;

class SyncTaskQueueTest {
  private static final Instant NOW = Instant.parse("2026-03-18T12:00:00Z");

  @Mock
  private SyncOrchestrator orchestrator;

  @Mock
  private BudgetAlertService budgetAlertService;

  @Mock
  private TaskScheduler timer;

  private SyncTaskQueue queue;
  private final UUID connectionId = UUID.randomUUID();
  private final UUID userId = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    SyncProperties properties = new SyncProperties(true, Duration.ofHours(1), Duration.ofMinutes(5), 30, 3,
        Duration.ofMinutes(5), 2);
    queue = new SyncTaskQueue(orchestrator, budgetAlertService, new SyncTaskExecutor(), timer, properties,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void successfulSyncRunsBudgetPass() {
    when(orchestrator.sync(connectionId, true)).thenReturn(success());

    queue.submit(connectionId, true);

    verify(budgetAlertService).run(userId);
    verify(timer, never()).schedule(any(Runnable.class), any(Instant.class));
  }

  @Test
  void transientFailureIsRetriedWithBackoff() {
    when(orchestrator.sync(eq(connectionId), anyBoolean())).thenReturn(transientFailure());

    queue.submit(connectionId, false);

    ArgumentCaptor<Runnable> retry = ArgumentCaptor.forClass(Runnable.class);
    ArgumentCaptor<Instant> at = ArgumentCaptor.forClass(Instant.class);
    verify(timer).schedule(retry.capture(), at.capture());
    assertThat(at.getValue()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));

    retry.getValue().run();

    verify(orchestrator).sync(connectionId, true);
    verify(timer, times(2)).schedule(retry.capture(), at.capture());
    assertThat(at.getValue()).isEqualTo(NOW.plus(Duration.ofMinutes(10)));
  }

  @Test
  void retriesStopAtMaxAttempts() {
    when(orchestrator.sync(eq(connectionId), anyBoolean())).thenReturn(transientFailure());

    SyncOutcome outcome = queue.runAttempt(connectionId, true, 3);

    assertThat(outcome.isRetryable()).isTrue();
    verify(timer, never()).schedule(any(Runnable.class), any(Instant.class));
  }

  @Test
  void reconnectRequiredIsNotRetried() {
    when(orchestrator.sync(connectionId, true)).thenReturn(SyncOutcome.rejected(connectionId, userId,
        SyncOutcome.Reason.RECONNECT_REQUIRED, ConnectionErrorCode.REAUTH_REQUIRED, "re-link"));

    queue.submit(connectionId, true);

    verify(timer, never()).schedule(any(Runnable.class), any(Instant.class));
    verify(budgetAlertService, never()).run(any());
  }

  @Test
  void budgetPassFailureDoesNotEscape() {
    when(orchestrator.sync(connectionId, true)).thenReturn(success());
    when(budgetAlertService.run(userId)).thenThrow(new IllegalStateException("db down"));

    SyncOutcome outcome = queue.runAttempt(connectionId, true, 1);

    assertThat(outcome.isSuccess()).isTrue();
  }

  @Test
  void retryDelayDoubles() {
    assertThat(queue.retryDelay(1)).isEqualTo(Duration.ofMinutes(5));
    assertThat(queue.retryDelay(2)).isEqualTo(Duration.ofMinutes(10));
    assertThat(queue.retryDelay(3)).isEqualTo(Duration.ofMinutes(20));
  }

  private SyncOutcome success() {
    return new SyncOutcome(SyncOutcome.Status.SUCCESS, SyncOutcome.Reason.COMPLETED, connectionId, userId,
        1, 0, 3, 0, 0, false, null, null);
  }

  private SyncOutcome transientFailure() {
    return new SyncOutcome(SyncOutcome.Status.ERROR, SyncOutcome.Reason.PROVIDER_ERROR, connectionId, userId,
        0, 0, 0, 0, 0, false, ConnectionErrorCode.PROVIDER_UNAVAILABLE, "503");
  }
}
