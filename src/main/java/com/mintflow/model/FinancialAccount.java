package com.mintflow.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(
    name = "financial_accounts",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_account_connection_external",
        columnNames = {"connection_id", "external_id"})
)
@Getter
@Setter
public class FinancialAccount {
  @Id
  private UUID id;

  @ManyToOne(optional = false, fetch = FetchType.LAZY)
  @JoinColumn(name = "connection_id")
  private Connection connection;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "external_id", nullable = false)
  private String externalId;

  @Column(nullable = false)
  private String name;

  @Column
  private String officialName;

  @Column(name = "account_type")
  private String type;

  @Column(name = "account_subtype")
  private String subtype;

  @Column(length = 8)
  private String mask;

  @Column(precision = 19, scale = 4)
  private BigDecimal currentBalance;

  @Column(precision = 19, scale = 4)
  private BigDecimal availableBalance;

  @Column(precision = 19, scale = 4)
  private BigDecimal creditLimit;

  @Column(nullable = false, length = 3)
  private String currency;

  @Column(nullable = false)
  private boolean active = true;

  @Column
  private Instant lastSyncedAt;

  @Column
  private Instant createdAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }
}
