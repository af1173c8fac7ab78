package com.mintflow.service;

import com.mintflow.model.ConnectionErrorCode;
import java.util.UUID;

public record SyncOutcome(
    Status status,
    Reason reason,
    UUID connectionId,
    UUID userId,
    int newAccounts,
    int updatedAccounts,
    int newTransactions,
    int updatedTransactions,
    int skippedTransactions,
    boolean reconnectRequired,
    ConnectionErrorCode errorCode,
    String message
) {
  public enum Status {
    SUCCESS,
    SKIPPED,
    ERROR
  }

  public enum Reason {
    COMPLETED,
    TOO_RECENT,
    ALREADY_RUNNING,
    CONNECTION_NOT_FOUND,
    CONNECTION_INACTIVE,
    RECONNECT_REQUIRED,
    PROVIDER_ERROR,
    TIMEOUT,
    INTERNAL_ERROR
  }

  static SyncOutcome skipped(UUID connectionId, UUID userId, Reason reason, String message) {
    return new SyncOutcome(Status.SKIPPED, reason, connectionId, userId, 0, 0, 0, 0, 0, false, null, message);
  }

  static SyncOutcome rejected(UUID connectionId, UUID userId, Reason reason, ConnectionErrorCode errorCode,
                              String message) {
    boolean reconnect = errorCode != null && errorCode.isBlocking();
    return new SyncOutcome(Status.ERROR, reason, connectionId, userId, 0, 0, 0, 0, 0, reconnect, errorCode, message);
  }

  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }

  public boolean isRetryable() {
    return status == Status.ERROR && errorCode != null && errorCode.isTransient();
  }
}
