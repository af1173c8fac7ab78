package com.mintflow.service;

import com.mintflow.dto.BudgetRequest;
import com.mintflow.dto.BudgetResponse;
import com.mintflow.model.Budget;
import com.mintflow.model.BudgetPeriod;
import com.mintflow.repository.BudgetRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

@Service
public class BudgetService {
  private static final Logger log = LoggerFactory.getLogger(BudgetService.class);

  private final BudgetRepository budgetRepository;
  private final BudgetEvaluator budgetEvaluator;
  private final Clock clock;

  public BudgetService(BudgetRepository budgetRepository, BudgetEvaluator budgetEvaluator, Clock clock) {
    this.budgetRepository = budgetRepository;
    this.budgetEvaluator = budgetEvaluator;
    this.clock = clock;
  }

  public List<BudgetResponse> listBudgets(UUID userId) {
    LocalDate today = LocalDate.now(clock);
    return budgetRepository.findByUserIdAndActiveTrue(userId).stream()
        .sorted(Comparator.comparing(Budget::getName, String.CASE_INSENSITIVE_ORDER))
        .map(budget -> toResponse(budget, today))
        .toList();
  }

  public BudgetResponse createBudget(UUID userId, BudgetRequest request) {
    LocalDate today = LocalDate.now(clock);
    String name = requireText(request.getName(), "name");
    String category = requireText(request.getCategory(), "category");
    BigDecimal amount = request.getAmount();
    if (amount == null || amount.signum() < 0) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "amount must be zero or positive");
    }
    LocalDate startDate = request.getStartDate() == null ? today : request.getStartDate();
    if (request.getEndDate() != null && request.getEndDate().isBefore(startDate)) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "endDate is before startDate");
    }
    Budget budget = new Budget();
    budget.setUserId(userId);
    budget.setName(name);
    budget.setCategory(category);
    budget.setAmount(amount);
    budget.setPeriod(request.getPeriod() == null ? BudgetPeriod.MONTHLY : request.getPeriod());
    budget.setStartDate(startDate);
    budget.setEndDate(request.getEndDate());
    budget.setActive(true);
    Budget saved = budgetRepository.save(budget);
    log.info("Created {} budget {} for user {} on {}", saved.getPeriod(), saved.getId(), userId, category);
    return toResponse(saved, today);
  }

  private BudgetResponse toResponse(Budget budget, LocalDate today) {
    LocalDate periodStart = budget.getPeriod().periodStart(today);
    BigDecimal spent = budget.coversDay(today)
        ? budgetEvaluator.spent(budget.getUserId(), budget.getCategory(), periodStart, today)
        : BigDecimal.ZERO;
    return new BudgetResponse(
        budget.getId(),
        budget.getName(),
        budget.getCategory(),
        budget.getAmount(),
        budget.getPeriod(),
        budget.getStartDate(),
        budget.getEndDate(),
        budget.isActive(),
        periodStart,
        spent,
        budget.getAmount().subtract(spent),
        BudgetEvaluator.usedPercent(spent, budget.getAmount()));
  }

  private static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, field + " is required");
    }
    return value.trim();
  }
}
