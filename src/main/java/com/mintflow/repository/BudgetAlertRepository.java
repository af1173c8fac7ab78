package com.mintflow.repository;

import com.mintflow.model.BudgetAlert;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BudgetAlertRepository extends JpaRepository<BudgetAlert, UUID> {
  boolean existsByBudgetIdAndThresholdAndPeriodStart(UUID budgetId, int threshold, LocalDate periodStart);

  List<BudgetAlert> findByBudgetId(UUID budgetId);
}
