package com.mintflow.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class BudgetPeriodTest {

  @Test
  void periodStartsAtCalendarBoundary() {
    LocalDate wednesday = LocalDate.of(2026, 3, 18);

    assertThat(BudgetPeriod.WEEKLY.periodStart(wednesday)).isEqualTo(LocalDate.of(2026, 3, 16));
    assertThat(BudgetPeriod.MONTHLY.periodStart(wednesday)).isEqualTo(LocalDate.of(2026, 3, 1));
    assertThat(BudgetPeriod.YEARLY.periodStart(wednesday)).isEqualTo(LocalDate.of(2026, 1, 1));
  }

  @Test
  void mondayStartsItsOwnWeek() {
    LocalDate monday = LocalDate.of(2026, 3, 16);

    assertThat(BudgetPeriod.WEEKLY.periodStart(monday)).isEqualTo(monday);
  }

  @Test
  void signConventionDecidesDirection() {
    assertThat(AmountSignConvention.POSITIVE_IS_DEBIT.directionOf(new BigDecimal("45.00")))
        .isEqualTo(TransactionDirection.DEBIT);
    assertThat(AmountSignConvention.POSITIVE_IS_DEBIT.directionOf(new BigDecimal("-45.00")))
        .isEqualTo(TransactionDirection.CREDIT);
    assertThat(AmountSignConvention.NEGATIVE_IS_DEBIT.directionOf(new BigDecimal("-45.00")))
        .isEqualTo(TransactionDirection.DEBIT);
    assertThat(AmountSignConvention.NEGATIVE_IS_DEBIT.directionOf(BigDecimal.ZERO))
        .isEqualTo(TransactionDirection.CREDIT);
  }

  @Test
  void budgetBoundsAreInclusive() {
    Budget budget = new Budget();
    budget.setStartDate(LocalDate.of(2026, 1, 1));
    budget.setEndDate(LocalDate.of(2026, 6, 30));

    assertThat(budget.coversDay(LocalDate.of(2026, 1, 1))).isTrue();
    assertThat(budget.coversDay(LocalDate.of(2026, 6, 30))).isTrue();
    assertThat(budget.coversDay(LocalDate.of(2025, 12, 31))).isFalse();
    assertThat(budget.coversDay(LocalDate.of(2026, 7, 1))).isFalse();
  }
}
