package com.mintflow.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

public enum BudgetPeriod {
  WEEKLY,
  MONTHLY,
  YEARLY;

  public LocalDate periodStart(LocalDate today) {
    return switch (this) {
      case WEEKLY -> today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
      case MONTHLY -> today.withDayOfMonth(1);
      case YEARLY -> today.withDayOfYear(1);
    };
  }
}
