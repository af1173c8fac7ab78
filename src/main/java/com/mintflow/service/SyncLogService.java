package com.mintflow.service;

import com.mintflow.model.SyncLog;
import com.mintflow.model.SyncLogStatus;
import com.mintflow.model.SyncType;
import com.mintflow.repository.SyncLogRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.springframework.stereotype.Service;

@Service
public class SyncLogService {
  private final SyncLogRepository syncLogRepository;
  private final Clock clock;

  public SyncLogService(SyncLogRepository syncLogRepository, Clock clock) {
    this.syncLogRepository = syncLogRepository;
    this.clock = clock;
  }

  public SyncLog record(UUID connectionId, long sequence, SyncType type, Instant startedAt,
                        SyncLogStatus status, ReconcileResult totals, String errorMessage) {
    SyncLog entry = new SyncLog();
    entry.setConnectionId(connectionId);
    entry.setSyncSequence(sequence);
    entry.setSyncType(type);
    entry.setStatus(status);
    entry.setNewItems(totals.created());
    entry.setUpdatedItems(totals.updated());
    entry.setSkippedItems(totals.skipped());
    entry.setErrorMessage(errorMessage);
    entry.setStartedAt(startedAt);
    entry.setCompletedAt(clock.instant());
    return syncLogRepository.save(entry);
  }
}
