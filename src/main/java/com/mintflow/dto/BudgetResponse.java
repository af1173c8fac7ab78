package com.mintflow.dto;

import com.mintflow.model.BudgetPeriod;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BudgetResponse {
  private UUID id;
  private String name;
  private String category;
  private BigDecimal amount;
  private BudgetPeriod period;
  private LocalDate startDate;
  private LocalDate endDate;
  private boolean active;
  private LocalDate periodStart;
  private BigDecimal spent;
  private BigDecimal remaining;
  private BigDecimal usedPercent;
}
