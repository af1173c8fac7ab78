package com.mintflow.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
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
    name = "budget_alerts",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_budget_alert_period",
        columnNames = {"budget_id", "threshold_percent", "period_start"})
)
@Getter
@Setter
public class BudgetAlert {
  @Id
  private UUID id;

  @Column(name = "budget_id", nullable = false)
  private UUID budgetId;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "threshold_percent", nullable = false)
  private int threshold;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private BudgetAlertType alertType;

  @Column(name = "period_start", nullable = false)
  private LocalDate periodStart;

  @Column(nullable = false)
  private String category;

  @Column(nullable = false)
  private String budgetName;

  @Column(nullable = false, precision = 19, scale = 4)
  private BigDecimal spentAmount;

  @Column(nullable = false, precision = 19, scale = 4)
  private BigDecimal budgetAmount;

  @Column(nullable = false)
  private Instant firedAt;

  @Column
  private Instant sentAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    if (firedAt == null) {
      firedAt = Instant.now();
    }
  }
}
