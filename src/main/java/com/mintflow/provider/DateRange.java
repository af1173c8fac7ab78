package com.mintflow.provider;

import java.time.LocalDate;

public record DateRange(LocalDate from, LocalDate to) {
  public DateRange {
    if (from == null || to == null || from.isAfter(to)) {
      throw new IllegalArgumentException("Invalid date range " + from + ".." + to);
    }
  }

  public static DateRange lookback(LocalDate today, int days) {
    return new DateRange(today.minusDays(days), today);
  }

  public boolean contains(LocalDate date) {
    return !date.isBefore(from) && !date.isAfter(to);
  }
}
