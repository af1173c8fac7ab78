package com.mintflow.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(
    name = "connections",
    indexes = @Index(name = "idx_connections_user", columnList = "user_id")
)
@Getter
@Setter
public class Connection {
  @Id
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "provider_id", nullable = false)
  private String providerId;

  @Column(name = "institution_id", nullable = false)
  private String institutionId;

  @Column
  private String institutionName;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String encryptedCredential;

  @Column
  private String externalItemId;

  @Column(name = "sync_cursor", columnDefinition = "TEXT")
  private String cursor;

  @Column(nullable = false)
  private boolean active = true;

  @Enumerated(EnumType.STRING)
  @Column(name = "sync_status", nullable = false)
  private SyncStatus syncStatus = SyncStatus.IDLE;

  @Column(name = "sync_sequence", nullable = false)
  private long syncSequence;

  @Column(name = "last_success_sequence", nullable = false)
  private long lastSuccessSequence;

  @Column(name = "sync_started_at")
  private Instant syncStartedAt;

  @Column(name = "last_sync_at")
  private Instant lastSyncAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "error_code")
  private ConnectionErrorCode errorCode;

  @Column(columnDefinition = "TEXT")
  private String errorMessage;

  @Column
  private Instant createdAt;

  @Column
  private Instant updatedAt;

  public boolean isReconnectRequired() {
    return syncStatus == SyncStatus.ERROR && errorCode != null && errorCode.isBlocking();
  }

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    Instant now = Instant.now();
    if (createdAt == null) {
      createdAt = now;
    }
    updatedAt = now;
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
  }
}
