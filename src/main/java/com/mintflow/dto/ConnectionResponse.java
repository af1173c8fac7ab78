package com.mintflow.dto;

import com.mintflow.model.ConnectionErrorCode;
import com.mintflow.model.SyncStatus;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ConnectionResponse {
  private UUID id;
  private String providerId;
  private String institutionId;
  private String institutionName;
  private boolean active;
  private SyncStatus syncStatus;
  private Instant lastSyncAt;
  private ConnectionErrorCode errorCode;
  private String errorMessage;
  private boolean reconnectRequired;
  private Instant createdAt;
}
