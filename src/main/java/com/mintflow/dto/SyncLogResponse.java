package com.mintflow.dto;

import com.mintflow.model.SyncLogStatus;
import com.mintflow.model.SyncType;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SyncLogResponse {
  private long syncSequence;
  private SyncType syncType;
  private SyncLogStatus status;
  private int newItems;
  private int updatedItems;
  private int skippedItems;
  private String errorMessage;
  private Instant startedAt;
  private Instant completedAt;
}
