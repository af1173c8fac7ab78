package com.mintflow.service;

import com.mintflow.model.ConnectionErrorCode;
import java.time.Instant;

public record SyncAttemptResult(
    long sequence,
    boolean success,
    ConnectionErrorCode errorCode,
    String errorMessage,
    Instant completedAt
) {
  public static SyncAttemptResult success(long sequence, Instant completedAt) {
    return new SyncAttemptResult(sequence, true, null, null, completedAt);
  }

  public static SyncAttemptResult failure(long sequence, ConnectionErrorCode errorCode, String errorMessage,
                                          Instant completedAt) {
    return new SyncAttemptResult(sequence, false, errorCode, errorMessage, completedAt);
  }
}
