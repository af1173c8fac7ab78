package com.mintflow.service;

import com.mintflow.categorizer.Categorizer;
import com.mintflow.categorizer.Classification;
import com.mintflow.config.LedgerProperties;
import com.mintflow.model.AccountTransaction;
import com.mintflow.model.Connection;
import com.mintflow.model.FinancialAccount;
import com.mintflow.provider.TransactionPage;
import com.mintflow.provider.TransactionSnapshot;
import com.mintflow.repository.AccountTransactionRepository;
import com.mintflow.repository.ConnectionRepository;
import com.mintflow.repository.FinancialAccountRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Merges provider transaction snapshots into the ledger. The merge key is (account, external
 * transaction id); settled rows and assigned categories are never rewritten.
 */
@Service
public class TransactionReconciler {
  private static final Logger log = LoggerFactory.getLogger(TransactionReconciler.class);

  private final AccountTransactionRepository transactionRepository;
  private final FinancialAccountRepository accountRepository;
  private final ConnectionRepository connectionRepository;
  private final ConnectionRegistry connectionRegistry;
  private final Categorizer categorizer;
  private final LedgerProperties ledgerProperties;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public TransactionReconciler(AccountTransactionRepository transactionRepository,
                               FinancialAccountRepository accountRepository,
                               ConnectionRepository connectionRepository,
                               ConnectionRegistry connectionRegistry,
                               Categorizer categorizer,
                               LedgerProperties ledgerProperties,
                               PlatformTransactionManager transactionManager,
                               Clock clock) {
    this.transactionRepository = transactionRepository;
    this.accountRepository = accountRepository;
    this.connectionRepository = connectionRepository;
    this.connectionRegistry = connectionRegistry;
    this.categorizer = categorizer;
    this.ledgerProperties = ledgerProperties;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
  }

  public Map<String, FinancialAccount> accountsOf(Connection connection) {
    Map<String, FinancialAccount> accounts = new LinkedHashMap<>();
    for (FinancialAccount account : accountRepository.findByConnectionId(connection.getId())) {
      accounts.put(account.getExternalId(), account);
    }
    return accounts;
  }

  public ReconcileResult reconcile(Connection connection,
                                   Map<String, FinancialAccount> accountsByExternalId,
                                   List<TransactionSnapshot> snapshots) {
    return transactionTemplate.execute(status -> {
      connectionRegistry.lockCurrentAttempt(connection);
      return apply(connection, accountsByExternalId, snapshots);
    });
  }

  /**
   * Applies one provider page and moves the connection's cursor past it in the same transaction,
   * so a replayed page after a crash finds either nothing or everything applied.
   */
  public ReconcileResult reconcilePage(Connection connection,
                                       Map<String, FinancialAccount> accountsByExternalId,
                                       TransactionPage page) {
    return transactionTemplate.execute(status -> {
      connectionRegistry.lockCurrentAttempt(connection);
      ReconcileResult result = apply(connection, accountsByExternalId, page.transactions());
      if (page.nextCursor() != null && !page.nextCursor().equals(connection.getCursor())) {
        connectionRepository.updateCursor(connection.getId(), page.nextCursor(), clock.instant());
        connection.setCursor(page.nextCursor());
      }
      return result;
    });
  }

  private ReconcileResult apply(Connection connection,
                                Map<String, FinancialAccount> accountsByExternalId,
                                List<TransactionSnapshot> snapshots) {
    int created = 0;
    int updated = 0;
    int skipped = 0;
    for (TransactionSnapshot snapshot : dedupe(connection, snapshots).values()) {
      FinancialAccount account = accountsByExternalId.get(snapshot.externalAccountId());
      if (account == null) {
        log.warn("Skipping transaction {} for unknown account {} on connection {}",
            snapshot.externalTransactionId(), snapshot.externalAccountId(), connection.getId());
        skipped++;
        continue;
      }
      AccountTransaction existing = transactionRepository
          .findByAccountIdAndExternalId(account.getId(), snapshot.externalTransactionId())
          .orElse(null);
      if (existing == null) {
        transactionRepository.save(newTransaction(account, snapshot));
        created++;
      } else if (existing.isPending() && refresh(existing, snapshot)) {
        transactionRepository.save(existing);
        updated++;
      }
    }
    return new ReconcileResult(created, updated, skipped);
  }

  private Map<String, TransactionSnapshot> dedupe(Connection connection, List<TransactionSnapshot> snapshots) {
    Map<String, TransactionSnapshot> byKey = new LinkedHashMap<>();
    for (TransactionSnapshot snapshot : snapshots) {
      String key = snapshot.externalAccountId() + "|" + snapshot.externalTransactionId();
      if (byKey.remove(key) != null) {
        log.warn("Duplicate transaction {} in batch for connection {}; keeping the later snapshot",
            snapshot.externalTransactionId(), connection.getId());
      }
      byKey.put(key, snapshot);
    }
    return byKey;
  }

  private AccountTransaction newTransaction(FinancialAccount account, TransactionSnapshot snapshot) {
    Classification classification = categorizer.classify(snapshot.classificationText());
    AccountTransaction tx = new AccountTransaction();
    tx.setAccount(accountRepository.getReferenceById(account.getId()));
    tx.setUserId(account.getUserId());
    tx.setExternalId(snapshot.externalTransactionId());
    tx.setAmount(snapshot.amount());
    tx.setCurrency(snapshot.currency() == null ? account.getCurrency() : snapshot.currency());
    tx.setBookingDate(snapshot.date());
    tx.setDescription(snapshot.description());
    tx.setMerchantName(snapshot.merchantName());
    tx.setPending(snapshot.pending());
    tx.setDirection(ledgerProperties.signConvention().directionOf(snapshot.amount()));
    tx.setCategory(classification.category());
    tx.setSubcategory(classification.subcategory());
    tx.setCategorySource(classification.source());
    tx.setCategoryConfidence(BigDecimal.valueOf(classification.confidence()).setScale(4, RoundingMode.HALF_UP));
    tx.setRawPayload(snapshot.rawPayload());
    return tx;
  }

  private boolean refresh(AccountTransaction tx, TransactionSnapshot snapshot) {
    String description = AccountTransaction.clip(snapshot.description());
    String merchant = AccountTransaction.clip(snapshot.merchantName());
    boolean changed = !AccountReconciler.sameAmount(tx.getAmount(), snapshot.amount())
        || !Objects.equals(tx.getDescription(), description)
        || !Objects.equals(tx.getMerchantName(), merchant)
        || !Objects.equals(tx.getBookingDate(), snapshot.date())
        || tx.isPending() != snapshot.pending();
    if (!changed) {
      return false;
    }
    tx.setAmount(snapshot.amount());
    tx.setDescription(description);
    tx.setMerchantName(merchant);
    tx.setBookingDate(snapshot.date());
    tx.setPending(snapshot.pending());
    tx.setDirection(ledgerProperties.signConvention().directionOf(snapshot.amount()));
    tx.setRawPayload(snapshot.rawPayload());
    return true;
  }
}
