package com.mintflow.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(
    name = "account_transactions",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_transaction_account_external",
        columnNames = {"account_id", "external_id"}),
    indexes = @Index(name = "idx_transactions_user_category_date",
        columnList = "user_id, category, booking_date")
)
@Getter
@Setter
public class AccountTransaction {
  private static final int DEFAULT_VARCHAR_LIMIT = 255;

  @Id
  private UUID id;

  @ManyToOne(optional = false, fetch = FetchType.LAZY)
  @JoinColumn(name = "account_id")
  private FinancialAccount account;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "external_id", nullable = false, length = 512)
  private String externalId;

  @Column(nullable = false, precision = 19, scale = 4)
  private BigDecimal amount;

  @Column(length = 3)
  private String currency;

  @Column(name = "booking_date", nullable = false)
  private LocalDate bookingDate;

  @Column(nullable = false)
  private String description;

  @Column
  private String merchantName;

  @Column
  private String category;

  @Column
  private String subcategory;

  @Enumerated(EnumType.STRING)
  @Column
  private CategorySource categorySource;

  @Column(precision = 5, scale = 4)
  private BigDecimal categoryConfidence;

  @Column(nullable = false)
  private boolean pending;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private TransactionDirection direction;

  @Column(columnDefinition = "TEXT")
  private String rawPayload;

  @Column(nullable = false)
  private Instant createdAt;

  @Column
  private Instant updatedAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    if (createdAt == null) {
      createdAt = Instant.now();
    }
    normalizeLengths();
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
    normalizeLengths();
  }

  private void normalizeLengths() {
    description = clip(description);
    merchantName = clip(merchantName);
  }

  public static String clip(String value) {
    return truncate(value, DEFAULT_VARCHAR_LIMIT);
  }

  private static String truncate(String value, int max) {
    if (value == null || value.length() <= max) {
      return value;
    }
    return value.substring(0, max);
  }
}
