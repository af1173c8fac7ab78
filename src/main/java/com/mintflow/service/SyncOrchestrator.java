package com.mintflow.service;

import com.mintflow.config.SyncProperties;
import com.mintflow.model.Connection;
import com.mintflow.model.ConnectionErrorCode;
import com.mintflow.model.FinancialAccount;
import com.mintflow.model.SyncLogStatus;
import com.mintflow.model.SyncType;
import com.mintflow.provider.AccountSnapshot;
import com.mintflow.provider.DateRange;
import com.mintflow.provider.ProviderClient;
import com.mintflow.provider.ProviderException;
import com.mintflow.provider.ProviderRegistry;
import com.mintflow.provider.ProviderUnavailableException;
import com.mintflow.provider.TransactionPage;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs one sync of a connection: accounts first, then transaction pages. Mutual exclusion and the
 * recorded outcome live on the connection row; the run itself happens on the sync worker pool
 * under the configured deadline.
 */
@Service
public class SyncOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

  private final ConnectionRegistry registry;
  private final ProviderRegistry providers;
  private final AccountReconciler accountReconciler;
  private final TransactionReconciler transactionReconciler;
  private final SyncLogService syncLogService;
  private final CredentialCipher credentialCipher;
  private final AsyncTaskExecutor syncWorkers;
  private final SyncProperties properties;
  private final Clock clock;

  public SyncOrchestrator(ConnectionRegistry registry,
                          ProviderRegistry providers,
                          AccountReconciler accountReconciler,
                          TransactionReconciler transactionReconciler,
                          SyncLogService syncLogService,
                          CredentialCipher credentialCipher,
                          @Qualifier("syncWorkers") AsyncTaskExecutor syncWorkers,
                          SyncProperties properties,
                          Clock clock) {
    this.registry = registry;
    this.providers = providers;
    this.accountReconciler = accountReconciler;
    this.transactionReconciler = transactionReconciler;
    this.syncLogService = syncLogService;
    this.credentialCipher = credentialCipher;
    this.syncWorkers = syncWorkers;
    this.properties = properties;
    this.clock = clock;
  }

  public SyncOutcome sync(UUID connectionId, boolean force) {
    Connection connection = registry.get(connectionId).orElse(null);
    if (connection == null) {
      return SyncOutcome.rejected(connectionId, null, SyncOutcome.Reason.CONNECTION_NOT_FOUND, null,
          "Connection not found");
    }
    if (!connection.isActive()) {
      return SyncOutcome.rejected(connectionId, connection.getUserId(), SyncOutcome.Reason.CONNECTION_INACTIVE,
          null, "Connection is no longer active");
    }
    if (connection.isReconnectRequired()) {
      return reconnectRequired(connection);
    }
    if (!force && syncedRecently(connection)) {
      return SyncOutcome.skipped(connectionId, connection.getUserId(), SyncOutcome.Reason.TOO_RECENT,
          "Last successful sync at " + connection.getLastSyncAt());
    }

    Optional<Long> sequence = registry.tryBeginSync(connectionId);
    if (sequence.isEmpty()) {
      Connection current = registry.get(connectionId).orElse(connection);
      if (current.isReconnectRequired()) {
        return reconnectRequired(current);
      }
      log.debug("Sync of connection {} already in progress", connectionId);
      return SyncOutcome.skipped(connectionId, connection.getUserId(), SyncOutcome.Reason.ALREADY_RUNNING,
          "A sync is already running for this connection");
    }
    long seq = sequence.get();
    Connection running = registry.get(connectionId).orElse(connection);
    log.info("Starting sync #{} of connection {} (force={})", seq, connectionId, force);
    return execute(running, seq);
  }

  private SyncOutcome execute(Connection connection, long seq) {
    UUID connectionId = connection.getId();
    Attempt attempt = new Attempt(seq);
    Future<SyncRun> future;
    try {
      future = syncWorkers.submit(() -> runAttempt(connection, attempt));
    } catch (RuntimeException ex) {
      log.error("Could not schedule sync #{} of connection {}", seq, connectionId, ex);
      return fail(connection, seq, SyncRun.EMPTY, ConnectionErrorCode.SYNC_ERROR,
          SyncOutcome.Reason.INTERNAL_ERROR, "Sync could not be scheduled");
    }

    SyncRun run;
    try {
      run = await(future, attempt);
    } catch (TimeoutException ex) {
      future.cancel(true);
      log.warn("Sync #{} of connection {} exceeded the {} deadline", seq, connectionId, properties.deadline());
      return abandoned(connection, attempt, SyncOutcome.Reason.TIMEOUT);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      if (attempt.abandon(ConnectionErrorCode.SYNC_ERROR, "Sync was interrupted")) {
        future.cancel(true);
        return abandoned(connection, attempt, SyncOutcome.Reason.INTERNAL_ERROR);
      }
      return fail(connection, seq, attempt.progress(), ConnectionErrorCode.SYNC_ERROR,
          SyncOutcome.Reason.INTERNAL_ERROR, "Sync was interrupted");
    } catch (ExecutionException ex) {
      log.error("Sync #{} of connection {} failed unexpectedly", seq, connectionId, ex.getCause());
      return fail(connection, seq, attempt.progress(), ConnectionErrorCode.SYNC_ERROR,
          SyncOutcome.Reason.INTERNAL_ERROR, String.valueOf(ex.getCause()));
    }

    if (run.errorCode() != null) {
      SyncOutcome.Reason reason = run.errorCode().isBlocking()
          ? SyncOutcome.Reason.RECONNECT_REQUIRED
          : run.errorCode() == ConnectionErrorCode.SYNC_ERROR
              ? SyncOutcome.Reason.INTERNAL_ERROR
              : SyncOutcome.Reason.PROVIDER_ERROR;
      return fail(connection, seq, run, run.errorCode(), reason, run.message());
    }

    registry.recordSyncResult(connectionId, SyncAttemptResult.success(seq, clock.instant()));
    log.info("Sync #{} of connection {} completed: accounts +{}/~{}, transactions +{}/~{} ({} skipped)",
        seq, connectionId, run.accounts().created(), run.accounts().updated(),
        run.transactions().created(), run.transactions().updated(), run.transactions().skipped());
    return new SyncOutcome(SyncOutcome.Status.SUCCESS, SyncOutcome.Reason.COMPLETED, connectionId,
        connection.getUserId(), run.accounts().created(), run.accounts().updated(),
        run.transactions().created(), run.transactions().updated(), run.transactions().skipped(),
        false, null, null);
  }

  // Throws TimeoutException only when the attempt was abandoned; a worker that finished in the
  // meantime still has its result collected.
  private SyncRun await(Future<SyncRun> future, Attempt attempt)
      throws InterruptedException, ExecutionException, TimeoutException {
    try {
      return future.get(properties.deadline().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      if (attempt.abandon(ConnectionErrorCode.SYNC_TIMEOUT, "Sync did not finish within " + properties.deadline())) {
        throw ex;
      }
      return future.get();
    }
  }

  private SyncOutcome fail(Connection connection, long seq, SyncRun run, ConnectionErrorCode code,
                           SyncOutcome.Reason reason, String message) {
    registry.recordSyncResult(connection.getId(), SyncAttemptResult.failure(seq, code, message, clock.instant()));
    return new SyncOutcome(SyncOutcome.Status.ERROR, reason, connection.getId(), connection.getUserId(),
        run.accounts().created(), run.accounts().updated(),
        run.transactions().created(), run.transactions().updated(), run.transactions().skipped(),
        code.isBlocking(), code, message);
  }

  // The worker still owns the connection; it moves it out of RUNNING when it exits.
  private SyncOutcome abandoned(Connection connection, Attempt attempt, SyncOutcome.Reason reason) {
    ConnectionErrorCode code = attempt.abandonCode;
    registry.recordAbandoned(connection.getId(), attempt.sequence, code, attempt.abandonMessage);
    SyncRun committed = attempt.progress();
    return new SyncOutcome(SyncOutcome.Status.ERROR, reason, connection.getId(), connection.getUserId(),
        committed.accounts().created(), committed.accounts().updated(),
        committed.transactions().created(), committed.transactions().updated(),
        committed.transactions().skipped(), false, code, attempt.abandonMessage);
  }

  private SyncOutcome reconnectRequired(Connection connection) {
    return SyncOutcome.rejected(connection.getId(), connection.getUserId(), SyncOutcome.Reason.RECONNECT_REQUIRED,
        ConnectionErrorCode.REAUTH_REQUIRED, "The institution must be re-linked before syncing");
  }

  private boolean syncedRecently(Connection connection) {
    Instant lastSync = connection.getLastSyncAt();
    return lastSync != null && lastSync.plus(properties.minInterval()).isAfter(clock.instant());
  }

  private SyncRun runAttempt(Connection connection, Attempt attempt) {
    try {
      return run(connection, attempt);
    } finally {
      if (!attempt.finish()) {
        release(connection, attempt);
      }
    }
  }

  private void release(Connection connection, Attempt attempt) {
    // Clear the cancellation interrupt before touching the database.
    Thread.interrupted();
    try {
      registry.recordSyncResult(connection.getId(), SyncAttemptResult.failure(attempt.sequence,
          attempt.abandonCode, attempt.abandonMessage, clock.instant()));
      log.info("Abandoned sync #{} of connection {} has stopped; connection released",
          attempt.sequence, connection.getId());
    } catch (RuntimeException ex) {
      log.error("Could not release connection {} after abandoned sync #{}", connection.getId(), attempt.sequence, ex);
    }
  }

  private String openCredential(Connection connection) {
    String sealed = connection.getEncryptedCredential();
    String credential = credentialCipher.open(connection.getProviderId(), sealed);
    if (credentialCipher.needsResealing(sealed)) {
      String resealed = credentialCipher.seal(connection.getProviderId(), credential);
      if (registry.replaceCredential(connection.getId(), sealed, resealed)) {
        log.info("Re-sealed credential of connection {} under the active key", connection.getId());
      }
    }
    return credential;
  }

  // Runs on a sync worker thread. Writes sync logs; the caller records the connection state.
  private SyncRun run(Connection connection, Attempt attempt) {
    long seq = attempt.sequence;
    ProviderClient provider;
    String credential;
    List<AccountSnapshot> accountSnapshots;
    Instant accountsStarted = clock.instant();
    ReconcileResult accounts;
    try {
      provider = providers.require(connection.getProviderId());
      credential = openCredential(connection);
      accountSnapshots = provider.fetchAccounts(credential);
      attempt.checkLive();
      accounts = accountReconciler.reconcile(connection, accountSnapshots);
      attempt.accounts = accounts;
    } catch (RuntimeException ex) {
      ConnectionErrorCode code = classify(ex);
      logFailure(connection, seq, SyncType.ACCOUNTS, ex);
      syncLogService.record(connection.getId(), seq, SyncType.ACCOUNTS, accountsStarted, SyncLogStatus.ERROR,
          ReconcileResult.EMPTY, ex.getMessage());
      return new SyncRun(ReconcileResult.EMPTY, ReconcileResult.EMPTY, code, ex.getMessage());
    }
    syncLogService.record(connection.getId(), seq, SyncType.ACCOUNTS, accountsStarted, SyncLogStatus.SUCCESS,
        accounts, null);

    Instant transactionsStarted = clock.instant();
    ReconcileResult transactions = ReconcileResult.EMPTY;
    int pages = 0;
    try {
      Map<String, FinancialAccount> accountsByExternalId = transactionReconciler.accountsOf(connection);
      // The lookback window bounds every page of an initial fetch, not only the first one.
      DateRange range = isBlank(connection.getCursor())
          ? DateRange.lookback(LocalDate.now(clock), properties.lookbackDays())
          : null;
      boolean hasMore = true;
      while (hasMore) {
        attempt.checkLive();
        String cursor = connection.getCursor();
        TransactionPage page = provider.fetchTransactions(credential, cursor, range);
        if (page.hasMore() && (page.nextCursor() == null || page.nextCursor().equals(cursor))) {
          throw new ProviderUnavailableException("Provider reported more pages without advancing the cursor");
        }
        attempt.checkLive();
        transactions = transactions.plus(transactionReconciler.reconcilePage(connection, accountsByExternalId, page));
        attempt.transactions = transactions;
        pages++;
        hasMore = page.hasMore();
      }
    } catch (RuntimeException ex) {
      ConnectionErrorCode code = classify(ex);
      logFailure(connection, seq, SyncType.TRANSACTIONS, ex);
      if (pages > 0) {
        syncLogService.record(connection.getId(), seq, SyncType.TRANSACTIONS, transactionsStarted,
            SyncLogStatus.PARTIAL, transactions, ex.getMessage());
        return new SyncRun(accounts, transactions, code, ex.getMessage());
      }
      syncLogService.record(connection.getId(), seq, SyncType.TRANSACTIONS, transactionsStarted,
          SyncLogStatus.ERROR, ReconcileResult.EMPTY, ex.getMessage());
      return new SyncRun(accounts, ReconcileResult.EMPTY, code, ex.getMessage());
    }
    syncLogService.record(connection.getId(), seq, SyncType.TRANSACTIONS, transactionsStarted,
        SyncLogStatus.SUCCESS, transactions, null);
    log.debug("Sync #{} of connection {} applied {} transaction pages", seq, connection.getId(), pages);
    return new SyncRun(accounts, transactions, null, null);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private ConnectionErrorCode classify(RuntimeException ex) {
    if (ex instanceof ProviderException providerException) {
      return providerException.errorCode();
    }
    if (ex instanceof CancellationException) {
      return ConnectionErrorCode.SYNC_TIMEOUT;
    }
    return ConnectionErrorCode.SYNC_ERROR;
  }

  private void logFailure(Connection connection, long seq, SyncType step, RuntimeException ex) {
    if (ex instanceof ProviderException || ex instanceof CancellationException
        || ex instanceof SupersededSyncException) {
      log.warn("Sync #{} of connection {} failed during {}: {}", seq, connection.getId(), step, ex.getMessage());
    } else {
      log.error("Sync #{} of connection {} failed during {}", seq, connection.getId(), step, ex);
    }
  }

  private record SyncRun(ReconcileResult accounts, ReconcileResult transactions,
                         ConnectionErrorCode errorCode, String message) {
    static final SyncRun EMPTY = new SyncRun(ReconcileResult.EMPTY, ReconcileResult.EMPTY, null, null);
  }

  /**
   * Hand-off between the calling thread and the worker. Whichever side moves the state out of
   * RUNNING first decides who records the final result: the caller when the worker finished in
   * time, the worker itself once the caller has abandoned it.
   */
  private static final class Attempt {
    private static final int RUNNING = 0;
    private static final int FINISHED = 1;
    private static final int ABANDONED = 2;

    private final long sequence;
    private final AtomicInteger state = new AtomicInteger(RUNNING);
    private volatile ConnectionErrorCode abandonCode;
    private volatile String abandonMessage;
    private volatile ReconcileResult accounts = ReconcileResult.EMPTY;
    private volatile ReconcileResult transactions = ReconcileResult.EMPTY;

    Attempt(long sequence) {
      this.sequence = sequence;
    }

    boolean abandon(ConnectionErrorCode code, String message) {
      abandonCode = code;
      abandonMessage = message;
      return state.compareAndSet(RUNNING, ABANDONED);
    }

    boolean finish() {
      return state.compareAndSet(RUNNING, FINISHED);
    }

    SyncRun progress() {
      return new SyncRun(accounts, transactions, null, null);
    }

    // Clears the interrupt so the failure can still be logged through the connection pool.
    void checkLive() {
      if (state.get() == ABANDONED || Thread.interrupted()) {
        Thread.interrupted();
        throw new CancellationException("Sync #" + sequence + " cancelled after the deadline");
      }
    }
  }
}
