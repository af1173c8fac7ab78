package com.mintflow.service;

import com.mintflow.config.BudgetProperties;
import com.mintflow.config.LedgerProperties;
import com.mintflow.model.AmountSignConvention;
import com.mintflow.model.Budget;
import com.mintflow.model.BudgetAlert;
import com.mintflow.model.BudgetAlertType;
import com.mintflow.repository.AccountTransactionRepository;
import com.mintflow.repository.BudgetAlertRepository;
import com.mintflow.repository.BudgetRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Compares period-to-date spend against each active budget and fires threshold alerts at most once
 * per budget, threshold and period.
 */
@Service
public class BudgetEvaluator {
  private static final Logger log = LoggerFactory.getLogger(BudgetEvaluator.class);
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final BudgetRepository budgetRepository;
  private final BudgetAlertRepository alertRepository;
  private final AccountTransactionRepository transactionRepository;
  private final BudgetProperties budgetProperties;
  private final LedgerProperties ledgerProperties;
  private final TransactionTemplate insertTemplate;
  private final Clock clock;

  public BudgetEvaluator(BudgetRepository budgetRepository,
                         BudgetAlertRepository alertRepository,
                         AccountTransactionRepository transactionRepository,
                         BudgetProperties budgetProperties,
                         LedgerProperties ledgerProperties,
                         PlatformTransactionManager transactionManager,
                         Clock clock) {
    this.budgetRepository = budgetRepository;
    this.alertRepository = alertRepository;
    this.transactionRepository = transactionRepository;
    this.budgetProperties = budgetProperties;
    this.ledgerProperties = ledgerProperties;
    this.insertTemplate = new TransactionTemplate(transactionManager);
    this.insertTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.clock = clock;
  }

  public List<BudgetAlert> evaluate(UUID userId) {
    LocalDate today = LocalDate.now(clock);
    List<BudgetAlert> fired = new ArrayList<>();
    for (Budget budget : budgetRepository.findByUserIdAndActiveTrue(userId)) {
      if (!budget.coversDay(today)) {
        continue;
      }
      LocalDate periodStart = budget.getPeriod().periodStart(today);
      BigDecimal spent = spent(userId, budget.getCategory(), periodStart, today);
      BigDecimal usedPercent = usedPercent(spent, budget.getAmount());
      for (Integer threshold : budgetProperties.thresholds()) {
        if (usedPercent.compareTo(BigDecimal.valueOf(threshold)) < 0) {
          continue;
        }
        if (alertRepository.existsByBudgetIdAndThresholdAndPeriodStart(budget.getId(), threshold, periodStart)) {
          continue;
        }
        BudgetAlert alert = insert(budget, threshold, periodStart, spent);
        if (alert != null) {
          log.info("Budget {} reached {}% ({} of {}) for period starting {}",
              budget.getId(), threshold, spent, budget.getAmount(), periodStart);
          fired.add(alert);
        }
      }
    }
    return fired;
  }

  public BigDecimal spent(UUID userId, String category, LocalDate from, LocalDate to) {
    if (ledgerProperties.signConvention() == AmountSignConvention.POSITIVE_IS_DEBIT) {
      BigDecimal sum = transactionRepository.sumPositiveAmounts(userId, category, from, to);
      return sum == null ? BigDecimal.ZERO : sum;
    }
    BigDecimal sum = transactionRepository.sumNegativeAmounts(userId, category, from, to);
    return sum == null ? BigDecimal.ZERO : sum.negate();
  }

  static BigDecimal usedPercent(BigDecimal spent, BigDecimal amount) {
    if (amount == null || amount.signum() == 0) {
      return BigDecimal.ZERO;
    }
    return spent.multiply(HUNDRED).divide(amount, 2, RoundingMode.HALF_UP);
  }

  private BudgetAlert insert(Budget budget, int threshold, LocalDate periodStart, BigDecimal spent) {
    BudgetAlert alert = new BudgetAlert();
    alert.setBudgetId(budget.getId());
    alert.setUserId(budget.getUserId());
    alert.setThreshold(threshold);
    alert.setAlertType(threshold >= 100 ? BudgetAlertType.EXCEEDED : BudgetAlertType.WARNING);
    alert.setPeriodStart(periodStart);
    alert.setCategory(budget.getCategory());
    alert.setBudgetName(budget.getName());
    alert.setSpentAmount(spent);
    alert.setBudgetAmount(budget.getAmount());
    alert.setFiredAt(clock.instant());
    try {
      return insertTemplate.execute(status -> alertRepository.saveAndFlush(alert));
    } catch (DataIntegrityViolationException ex) {
      log.debug("Alert for budget {} at {}% already fired concurrently", budget.getId(), threshold);
      return null;
    }
  }
}
