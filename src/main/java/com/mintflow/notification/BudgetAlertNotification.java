package com.mintflow.notification;

import com.mintflow.model.BudgetAlert;
import com.mintflow.model.BudgetAlertType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record BudgetAlertNotification(
    UUID userId,
    String type,
    UUID budgetId,
    int threshold,
    BigDecimal spentAmount,
    BigDecimal budgetAmount,
    String category,
    BudgetAlertType alertType,
    String budgetName,
    LocalDate periodStart
) {
  public static final String TYPE = "budget_alert";

  public static BudgetAlertNotification of(BudgetAlert alert) {
    return new BudgetAlertNotification(alert.getUserId(), TYPE, alert.getBudgetId(), alert.getThreshold(),
        alert.getSpentAmount(), alert.getBudgetAmount(), alert.getCategory(), alert.getAlertType(),
        alert.getBudgetName(), alert.getPeriodStart());
  }
}
