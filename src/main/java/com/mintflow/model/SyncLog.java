package com.mintflow.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(
    name = "sync_logs",
    indexes = @Index(name = "idx_sync_logs_connection", columnList = "connection_id, started_at")
)
@Getter
@Setter
public class SyncLog {
  @Id
  private UUID id;

  @Column(name = "connection_id", nullable = false)
  private UUID connectionId;

  @Column(name = "sync_sequence", nullable = false)
  private long syncSequence;

  @Enumerated(EnumType.STRING)
  @Column(name = "sync_type", nullable = false)
  private SyncType syncType;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private SyncLogStatus status;

  @Column(nullable = false)
  private int newItems;

  @Column(nullable = false)
  private int updatedItems;

  @Column(nullable = false)
  private int skippedItems;

  @Column(columnDefinition = "TEXT")
  private String errorMessage;

  @Column(name = "started_at", nullable = false)
  private Instant startedAt;

  @Column
  private Instant completedAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
  }
}
