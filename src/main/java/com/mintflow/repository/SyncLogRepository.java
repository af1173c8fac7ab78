package com.mintflow.repository;

import com.mintflow.model.SyncLog;
import com.mintflow.model.SyncType;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SyncLogRepository extends JpaRepository<SyncLog, UUID> {
  List<SyncLog> findByConnectionIdOrderByStartedAtDesc(UUID connectionId);

  List<SyncLog> findByConnectionIdAndSyncTypeOrderByStartedAtAsc(UUID connectionId, SyncType syncType);
}
