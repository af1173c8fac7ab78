package com.mintflow.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mintflow.IntegrationTestSupport;
import com.mintflow.config.BudgetProperties;
import com.mintflow.config.LedgerProperties;
import com.mintflow.dto.BudgetRequest;
import com.mintflow.dto.BudgetResponse;
import com.mintflow.model.BudgetPeriod;
import com.mintflow.model.Connection;
import com.mintflow.model.FinancialAccount;
import com.mintflow.provider.TransactionSnapshot;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.web.server.ResponseStatusException;

class BudgetServiceTest extends IntegrationTestSupport {
  private static final LocalDate TODAY = LocalDate.of(2026, 3, 18);

  @Autowired
  private AccountReconciler accountReconciler;
  @Autowired
  private TransactionReconciler transactionReconciler;
  @Autowired
  private BudgetProperties budgetProperties;
  @Autowired
  private LedgerProperties ledgerProperties;
  @Autowired
  private PlatformTransactionManager transactionManager;

  private BudgetService budgetService;
  private Connection connection;
  private Map<String, FinancialAccount> accounts;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(Instant.parse("2026-03-18T12:00:00Z"), ZoneOffset.UTC);
    BudgetEvaluator evaluator = new BudgetEvaluator(budgetRepository, budgetAlertRepository, transactionRepository,
        budgetProperties, ledgerProperties, transactionManager, clock);
    budgetService = new BudgetService(budgetRepository, evaluator, clock);
    connection = newConnection();
    accountReconciler.reconcile(connection, List.of(checking("acc-1", "2000.00")));
    accounts = transactionReconciler.accountsOf(connection);
  }

  @Test
  void createdBudgetDefaultsToMonthlyFromToday() {
    BudgetResponse created = budgetService.createBudget(userId, request(" Coffee ", "Food & Dining", "120.00"));

    assertThat(created.getId()).isNotNull();
    assertThat(created.getName()).isEqualTo("Coffee");
    assertThat(created.getPeriod()).isEqualTo(BudgetPeriod.MONTHLY);
    assertThat(created.getStartDate()).isEqualTo(TODAY);
    assertThat(created.getPeriodStart()).isEqualTo(LocalDate.of(2026, 3, 1));
    assertThat(created.isActive()).isTrue();
    assertThat(budgetRepository.findByUserIdAndActiveTrue(userId)).hasSize(1);
  }

  @Test
  void listingReportsSpendAndRemainingForTheCurrentPeriod() {
    budgetService.createBudget(userId, request("Groceries", "Groceries", "300.00"));
    BudgetRequest coffee = request("Coffee", "Food & Dining", "100.00");
    coffee.setStartDate(LocalDate.of(2026, 1, 1));
    budgetService.createBudget(userId, coffee);
    spend("tx-1", "45.50", "STARBUCKS 001", LocalDate.of(2026, 3, 5));
    spend("tx-2", "20.00", "STARBUCKS 002", LocalDate.of(2026, 3, 17));
    spend("tx-3", "99.00", "STARBUCKS FEB", LocalDate.of(2026, 2, 20));

    List<BudgetResponse> budgets = budgetService.listBudgets(userId);

    assertThat(budgets).extracting(BudgetResponse::getName).containsExactly("Coffee", "Groceries");
    BudgetResponse coffeeBudget = budgets.get(0);
    assertThat(coffeeBudget.getSpent()).isEqualByComparingTo("65.50");
    assertThat(coffeeBudget.getRemaining()).isEqualByComparingTo("34.50");
    assertThat(coffeeBudget.getUsedPercent()).isEqualByComparingTo("65.50");
    assertThat(budgets.get(1).getSpent()).isEqualByComparingTo("0");
    assertThat(budgetService.listBudgets(UUID.randomUUID())).isEmpty();
  }

  @Test
  void budgetStartingLaterHasNothingSpentYet() {
    BudgetRequest later = request("Coffee", "Food & Dining", "100.00");
    later.setStartDate(LocalDate.of(2026, 4, 1));
    spend("tx-1", "45.00", "STARBUCKS", LocalDate.of(2026, 3, 10));

    BudgetResponse created = budgetService.createBudget(userId, later);

    assertThat(created.getSpent()).isEqualByComparingTo("0");
    assertThat(created.getRemaining()).isEqualByComparingTo("100.00");
  }

  @Test
  void invalidRequestsAreRejected() {
    BudgetRequest backwards = request("Coffee", "Food & Dining", "10.00");
    backwards.setStartDate(LocalDate.of(2026, 3, 10));
    backwards.setEndDate(LocalDate.of(2026, 3, 1));

    assertBadRequest(request(" ", "Food & Dining", "10.00"));
    assertBadRequest(request("Coffee", null, "10.00"));
    assertBadRequest(request("Coffee", "Food & Dining", null));
    assertBadRequest(request("Coffee", "Food & Dining", "-1.00"));
    assertBadRequest(backwards);
    assertThat(budgetRepository.count()).isZero();
  }

  private void assertBadRequest(BudgetRequest request) {
    assertThatThrownBy(() -> budgetService.createBudget(userId, request))
        .isInstanceOf(ResponseStatusException.class)
        .extracting(ex -> ((ResponseStatusException) ex).getStatusCode())
        .isEqualTo(HttpStatus.BAD_REQUEST);
  }

  private static BudgetRequest request(String name, String category, String amount) {
    BudgetRequest request = new BudgetRequest();
    request.setName(name);
    request.setCategory(category);
    request.setAmount(amount == null ? null : new BigDecimal(amount));
    return request;
  }

  private void spend(String externalId, String amount, String description, LocalDate date) {
    TransactionSnapshot snapshot = new TransactionSnapshot(externalId, "acc-1", new BigDecimal(amount), "USD",
        date, description, null, false, "{}");
    transactionReconciler.reconcile(connection, accounts, List.of(snapshot));
  }
}
