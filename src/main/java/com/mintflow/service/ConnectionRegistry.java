package com.mintflow.service;

import com.mintflow.config.SyncProperties;
import com.mintflow.model.Connection;
import com.mintflow.model.ConnectionErrorCode;
import com.mintflow.model.SyncStatus;
import com.mintflow.provider.TokenExchange;
import com.mintflow.repository.ConnectionRepository;
import com.mintflow.repository.FinancialAccountRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.server.ResponseStatusException;

/**
 * Owns connection records and their sync state. The connection row is the only state shared
 * between concurrent sync attempts, so every state change here is a single conditional update or
 * runs under a row lock.
 */
@Service
public class ConnectionRegistry {
  private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

  private final ConnectionRepository connectionRepository;
  private final FinancialAccountRepository accountRepository;
  private final TransactionTemplate transactionTemplate;
  private final SyncProperties syncProperties;
  private final Clock clock;

  public ConnectionRegistry(ConnectionRepository connectionRepository,
                            FinancialAccountRepository accountRepository,
                            PlatformTransactionManager transactionManager,
                            SyncProperties syncProperties,
                            Clock clock) {
    this.connectionRepository = connectionRepository;
    this.accountRepository = accountRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.syncProperties = syncProperties;
    this.clock = clock;
  }

  public Optional<Connection> get(UUID connectionId) {
    return connectionRepository.findById(connectionId);
  }

  public Connection requireOwned(UUID userId, UUID connectionId) {
    return connectionRepository.findByIdAndUserId(connectionId, userId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Connection not found"));
  }

  public List<Connection> listActive(UUID userId) {
    return connectionRepository.findByUserIdAndActiveTrue(userId);
  }

  public List<Connection> listAllActive() {
    return connectionRepository.findByActiveTrue();
  }

  public Optional<Connection> findLinked(UUID userId, String institutionId, String providerId) {
    return connectionRepository.findFirstByUserIdAndInstitutionIdAndProviderIdAndActiveTrue(
        userId, institutionId, providerId);
  }

  /**
   * Atomically moves the connection to RUNNING and returns the new sync sequence, or empty when
   * another attempt holds it, it is inactive, or it waits for a re-link.
   */
  public Optional<Long> tryBeginSync(UUID connectionId) {
    Long sequence = transactionTemplate.execute(status -> {
      Instant now = clock.instant();
      Instant staleBefore = now.minus(syncProperties.staleRunAfter());
      if (connectionRepository.markRunning(connectionId, now, staleBefore) == 0) {
        return null;
      }
      return connectionRepository.findById(connectionId).map(Connection::getSyncSequence).orElse(null);
    });
    return Optional.ofNullable(sequence);
  }

  public void recordSyncResult(UUID connectionId, SyncAttemptResult result) {
    transactionTemplate.executeWithoutResult(status -> {
      Connection connection = connectionRepository.findForUpdate(connectionId)
          .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Connection not found"));
      boolean currentAttempt = connection.getSyncSequence() == result.sequence();
      if (result.success()) {
        applySuccess(connection, result, currentAttempt);
      } else {
        applyFailure(connection, result, currentAttempt);
      }
      connectionRepository.save(connection);
    });
  }

  private void applySuccess(Connection connection, SyncAttemptResult result, boolean currentAttempt) {
    if (result.sequence() > connection.getLastSuccessSequence()) {
      connection.setLastSuccessSequence(result.sequence());
      connection.setLastSyncAt(result.completedAt());
      connection.setErrorCode(null);
      connection.setErrorMessage(null);
    } else {
      log.info("Ignoring stale success #{} for connection {}; #{} already recorded",
          result.sequence(), connection.getId(), connection.getLastSuccessSequence());
    }
    if (currentAttempt) {
      connection.setSyncStatus(SyncStatus.IDLE);
      connection.setSyncStartedAt(null);
    }
  }

  private void applyFailure(Connection connection, SyncAttemptResult result, boolean currentAttempt) {
    if (!currentAttempt) {
      log.info("Ignoring failure of superseded attempt #{} for connection {}", result.sequence(), connection.getId());
      return;
    }
    ConnectionErrorCode code = result.errorCode() == null ? ConnectionErrorCode.SYNC_ERROR : result.errorCode();
    connection.setErrorCode(code);
    connection.setErrorMessage(result.errorMessage());
    connection.setSyncStartedAt(null);
    boolean leaveInError = code.isBlocking() || code == ConnectionErrorCode.SYNC_TIMEOUT;
    connection.setSyncStatus(leaveInError ? SyncStatus.ERROR : SyncStatus.IDLE);
    if (code.isBlocking()) {
      log.warn("Connection {} requires a re-link: {}", connection.getId(), result.errorMessage());
    }
  }

  /**
   * Records why an attempt was given up while its worker is still running. The connection stays
   * RUNNING until the worker exits and reports through {@link #recordSyncResult}.
   */
  public void recordAbandoned(UUID connectionId, long sequence, ConnectionErrorCode code, String message) {
    transactionTemplate.executeWithoutResult(status -> {
      Connection connection = connectionRepository.findForUpdate(connectionId)
          .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Connection not found"));
      if (connection.getSyncSequence() != sequence) {
        log.info("Ignoring abandonment of superseded attempt #{} for connection {}", sequence, connectionId);
        return;
      }
      connection.setErrorCode(code);
      connection.setErrorMessage(message);
      connectionRepository.save(connection);
    });
  }

  /**
   * Row-locks the connection inside the caller's transaction. Fails when another attempt has begun
   * since {@code connection} was read, so a worker left over from a timed-out run cannot commit.
   */
  public void lockCurrentAttempt(Connection connection) {
    if (connectionRepository.findCurrentForUpdate(connection.getId(), connection.getSyncSequence()).isEmpty()) {
      throw new SupersededSyncException(connection.getId(), connection.getSyncSequence());
    }
  }

  /**
   * Swaps in a re-sealed credential. A no-op when the stored value changed since it was read,
   * for example by a relink.
   */
  public boolean replaceCredential(UUID connectionId, String previous, String resealed) {
    return connectionRepository.replaceCredential(connectionId, previous, resealed, clock.instant()) == 1;
  }

  public void advanceCursor(UUID connectionId, String cursor) {
    connectionRepository.updateCursor(connectionId, cursor, clock.instant());
  }

  public void deactivate(UUID connectionId) {
    transactionTemplate.executeWithoutResult(status -> {
      Connection connection = connectionRepository.findForUpdate(connectionId)
          .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Connection not found"));
      connection.setActive(false);
      connectionRepository.save(connection);
      int accounts = accountRepository.deactivateByConnectionId(connectionId);
      log.info("Deactivated connection {} and {} accounts", connectionId, accounts);
    });
  }

  public Connection register(UUID userId, String providerId, TokenExchange exchange, String sealedCredential) {
    Connection connection = new Connection();
    connection.setUserId(userId);
    connection.setProviderId(providerId);
    connection.setInstitutionId(exchange.institutionId());
    connection.setInstitutionName(exchange.institutionName());
    connection.setExternalItemId(exchange.itemId());
    connection.setEncryptedCredential(sealedCredential);
    connection.setActive(true);
    connection.setSyncStatus(SyncStatus.IDLE);
    return connectionRepository.save(connection);
  }

  public Connection relink(UUID connectionId, TokenExchange exchange, String sealedCredential) {
    return transactionTemplate.execute(status -> {
      Connection connection = connectionRepository.findForUpdate(connectionId)
          .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Connection not found"));
      connection.setEncryptedCredential(sealedCredential);
      if (exchange.itemId() != null) {
        connection.setExternalItemId(exchange.itemId());
      }
      if (exchange.institutionName() != null) {
        connection.setInstitutionName(exchange.institutionName());
      }
      connection.setErrorCode(null);
      connection.setErrorMessage(null);
      if (connection.getSyncStatus() != SyncStatus.RUNNING) {
        connection.setSyncStatus(SyncStatus.IDLE);
      }
      return connectionRepository.save(connection);
    });
  }
}
