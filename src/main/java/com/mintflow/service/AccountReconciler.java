package com.mintflow.service;

import com.mintflow.model.Connection;
import com.mintflow.model.FinancialAccount;
import com.mintflow.provider.AccountSnapshot;
import com.mintflow.repository.ConnectionRepository;
import com.mintflow.repository.FinancialAccountRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
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
 * Applies a batch of account snapshots to the stored accounts of one connection. Accounts missing
 * from the batch are left untouched.
 */
@Service
public class AccountReconciler {
  private static final Logger log = LoggerFactory.getLogger(AccountReconciler.class);

  private final FinancialAccountRepository accountRepository;
  private final ConnectionRepository connectionRepository;
  private final ConnectionRegistry connectionRegistry;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public AccountReconciler(FinancialAccountRepository accountRepository,
                           ConnectionRepository connectionRepository,
                           ConnectionRegistry connectionRegistry,
                           PlatformTransactionManager transactionManager,
                           Clock clock) {
    this.accountRepository = accountRepository;
    this.connectionRepository = connectionRepository;
    this.connectionRegistry = connectionRegistry;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
  }

  public ReconcileResult reconcile(Connection connection, List<AccountSnapshot> snapshots) {
    Map<String, AccountSnapshot> byExternalId = dedupe(connection, snapshots);
    if (byExternalId.isEmpty()) {
      return ReconcileResult.EMPTY;
    }
    return transactionTemplate.execute(status -> {
      connectionRegistry.lockCurrentAttempt(connection);
      Instant now = clock.instant();
      int created = 0;
      int updated = 0;
      for (AccountSnapshot snapshot : byExternalId.values()) {
        FinancialAccount existing = accountRepository
            .findByConnectionIdAndExternalId(connection.getId(), snapshot.externalAccountId())
            .orElse(null);
        if (existing == null) {
          FinancialAccount account = new FinancialAccount();
          account.setConnection(connectionRepository.getReferenceById(connection.getId()));
          account.setUserId(connection.getUserId());
          account.setExternalId(snapshot.externalAccountId());
          account.setActive(true);
          apply(account, snapshot);
          account.setLastSyncedAt(now);
          accountRepository.save(account);
          created++;
        } else {
          boolean changed = !matches(existing, snapshot);
          if (changed) {
            apply(existing, snapshot);
            updated++;
          }
          existing.setLastSyncedAt(now);
          accountRepository.save(existing);
        }
      }
      log.debug("Reconciled accounts for connection {}: {} created, {} updated",
          connection.getId(), created, updated);
      return new ReconcileResult(created, updated, 0);
    });
  }

  private Map<String, AccountSnapshot> dedupe(Connection connection, List<AccountSnapshot> snapshots) {
    Map<String, AccountSnapshot> byExternalId = new LinkedHashMap<>();
    for (AccountSnapshot snapshot : snapshots) {
      if (byExternalId.put(snapshot.externalAccountId(), snapshot) != null) {
        log.warn("Duplicate account {} in batch for connection {}; keeping the later snapshot",
            snapshot.externalAccountId(), connection.getId());
      }
    }
    return byExternalId;
  }

  private void apply(FinancialAccount account, AccountSnapshot snapshot) {
    account.setName(snapshot.name());
    account.setOfficialName(snapshot.officialName());
    account.setType(snapshot.type());
    account.setSubtype(snapshot.subtype());
    account.setMask(snapshot.mask());
    account.setCurrentBalance(snapshot.currentBalance());
    account.setAvailableBalance(snapshot.availableBalance());
    account.setCreditLimit(snapshot.creditLimit());
    account.setCurrency(snapshot.currency());
  }

  private boolean matches(FinancialAccount account, AccountSnapshot snapshot) {
    return Objects.equals(account.getName(), snapshot.name())
        && Objects.equals(account.getOfficialName(), snapshot.officialName())
        && Objects.equals(account.getType(), snapshot.type())
        && Objects.equals(account.getSubtype(), snapshot.subtype())
        && Objects.equals(account.getMask(), snapshot.mask())
        && Objects.equals(account.getCurrency(), snapshot.currency())
        && sameAmount(account.getCurrentBalance(), snapshot.currentBalance())
        && sameAmount(account.getAvailableBalance(), snapshot.availableBalance())
        && sameAmount(account.getCreditLimit(), snapshot.creditLimit());
  }

  static boolean sameAmount(BigDecimal left, BigDecimal right) {
    if (left == null || right == null) {
      return left == right;
    }
    return left.compareTo(right) == 0;
  }
}
