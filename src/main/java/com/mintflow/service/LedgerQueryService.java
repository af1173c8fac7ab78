package com.mintflow.service;

import com.mintflow.dto.AccountResponse;
import com.mintflow.dto.ConnectionResponse;
import com.mintflow.dto.SyncLogResponse;
import com.mintflow.dto.TransactionResponse;
import com.mintflow.model.AccountTransaction;
import com.mintflow.model.Connection;
import com.mintflow.model.FinancialAccount;
import com.mintflow.model.SyncLog;
import com.mintflow.repository.AccountTransactionRepository;
import com.mintflow.repository.FinancialAccountRepository;
import com.mintflow.repository.SyncLogRepository;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

@Service
public class LedgerQueryService {
  private static final int MAX_PAGE_SIZE = 200;

  private final ConnectionRegistry registry;
  private final FinancialAccountRepository accountRepository;
  private final AccountTransactionRepository transactionRepository;
  private final SyncLogRepository syncLogRepository;

  public LedgerQueryService(ConnectionRegistry registry,
                            FinancialAccountRepository accountRepository,
                            AccountTransactionRepository transactionRepository,
                            SyncLogRepository syncLogRepository) {
    this.registry = registry;
    this.accountRepository = accountRepository;
    this.transactionRepository = transactionRepository;
    this.syncLogRepository = syncLogRepository;
  }

  public List<ConnectionResponse> listConnections(UUID userId) {
    return registry.listActive(userId).stream()
        .map(LedgerQueryService::toConnectionResponse)
        .toList();
  }

  public List<AccountResponse> listAccounts(UUID userId) {
    return accountRepository.findByUserIdAndActiveTrueOrderByNameAsc(userId).stream()
        .map(this::toAccountResponse)
        .toList();
  }

  public List<TransactionResponse> listTransactions(UUID userId, UUID accountId, int page, int size) {
    int safeSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
    int safePage = Math.max(0, page);
    return transactionRepository.findVisible(userId, accountId, PageRequest.of(safePage, safeSize))
        .map(this::toTransactionResponse)
        .getContent();
  }

  public List<SyncLogResponse> syncHistory(UUID userId, UUID connectionId) {
    Connection connection = registry.requireOwned(userId, connectionId);
    return syncLogRepository.findByConnectionIdOrderByStartedAtDesc(connection.getId()).stream()
        .map(this::toSyncLogResponse)
        .toList();
  }

  static ConnectionResponse toConnectionResponse(Connection connection) {
    return new ConnectionResponse(
        connection.getId(),
        connection.getProviderId(),
        connection.getInstitutionId(),
        connection.getInstitutionName(),
        connection.isActive(),
        connection.getSyncStatus(),
        connection.getLastSyncAt(),
        connection.getErrorCode(),
        connection.getErrorMessage(),
        connection.isReconnectRequired(),
        connection.getCreatedAt()
    );
  }

  private AccountResponse toAccountResponse(FinancialAccount account) {
    return new AccountResponse(
        account.getId(),
        account.getConnection().getId(),
        account.getName(),
        account.getOfficialName(),
        account.getType(),
        account.getSubtype(),
        account.getMask(),
        account.getCurrentBalance(),
        account.getAvailableBalance(),
        account.getCreditLimit(),
        account.getCurrency(),
        account.getLastSyncedAt()
    );
  }

  private TransactionResponse toTransactionResponse(AccountTransaction tx) {
    return new TransactionResponse(
        tx.getId(),
        tx.getAccount().getId(),
        tx.getAmount(),
        tx.getCurrency(),
        tx.getDirection(),
        tx.getDescription(),
        tx.getMerchantName(),
        tx.getBookingDate(),
        tx.isPending(),
        tx.getCategory(),
        tx.getSubcategory(),
        tx.getCategorySource(),
        tx.getCategoryConfidence()
    );
  }

  private SyncLogResponse toSyncLogResponse(SyncLog entry) {
    return new SyncLogResponse(
        entry.getSyncSequence(),
        entry.getSyncType(),
        entry.getStatus(),
        entry.getNewItems(),
        entry.getUpdatedItems(),
        entry.getSkippedItems(),
        entry.getErrorMessage(),
        entry.getStartedAt(),
        entry.getCompletedAt()
    );
  }
}
