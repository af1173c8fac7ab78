package com.mintflow.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mintflow.budget")
public record BudgetProperties(List<Integer> thresholds) {
  public BudgetProperties {
    thresholds = thresholds == null || thresholds.isEmpty()
        ? List.of(80, 100)
        : thresholds.stream().distinct().sorted().toList();
  }
}
