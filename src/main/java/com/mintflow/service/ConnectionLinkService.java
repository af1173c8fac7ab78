package com.mintflow.service;

import com.mintflow.dto.ConnectionResponse;
import com.mintflow.model.Connection;
import com.mintflow.provider.LinkToken;
import com.mintflow.provider.ProviderAuthException;
import com.mintflow.provider.ProviderClient;
import com.mintflow.provider.ProviderException;
import com.mintflow.provider.ProviderRegistry;
import com.mintflow.provider.SnapshotValidationException;
import com.mintflow.provider.TokenExchange;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

@Service
public class ConnectionLinkService {
  private static final Logger log = LoggerFactory.getLogger(ConnectionLinkService.class);

  private final ProviderRegistry providers;
  private final ConnectionRegistry registry;
  private final CredentialCipher credentialCipher;
  private final SyncTaskQueue syncTaskQueue;

  public ConnectionLinkService(ProviderRegistry providers,
                               ConnectionRegistry registry,
                               CredentialCipher credentialCipher,
                               SyncTaskQueue syncTaskQueue) {
    this.providers = providers;
    this.registry = registry;
    this.credentialCipher = credentialCipher;
    this.syncTaskQueue = syncTaskQueue;
  }

  public LinkToken createLinkToken(UUID userId, String providerId) {
    ProviderClient provider = providers.require(providerId);
    try {
      LinkToken token = provider.createLinkToken(userId.toString());
      log.debug("Issued {} link token for user {}", providerId, userId);
      return token;
    } catch (ProviderException | SnapshotValidationException ex) {
      log.warn("Could not create {} link token for user {}: {}", providerId, userId, ex.getMessage());
      throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "Could not start the link flow", ex);
    }
  }

  public ConnectionResponse link(UUID userId, String providerId, String publicToken) {
    if (publicToken == null || publicToken.isBlank()) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "publicToken is required");
    }
    ProviderClient provider = providers.require(providerId);
    TokenExchange exchange;
    try {
      exchange = provider.exchangeToken(publicToken);
    } catch (ProviderAuthException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Link token was rejected", ex);
    } catch (ProviderException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "Provider is unavailable", ex);
    } catch (SnapshotValidationException ex) {
      log.warn("Token exchange with {} returned an unusable payload: {}", providerId, ex.getMessage());
      throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "Provider returned an invalid token exchange", ex);
    }
    String sealed = credentialCipher.seal(providerId, exchange.credential());
    Connection connection = registry.findLinked(userId, exchange.institutionId(), providerId)
        .map(existing -> {
          log.info("Re-linking connection {} for user {}", existing.getId(), userId);
          return registry.relink(existing.getId(), exchange, sealed);
        })
        .orElseGet(() -> registry.register(userId, providerId, exchange, sealed));
    syncTaskQueue.submit(connection.getId(), true);
    return LedgerQueryService.toConnectionResponse(connection);
  }

  public void unlink(UUID userId, UUID connectionId) {
    Connection connection = registry.requireOwned(userId, connectionId);
    registry.deactivate(connection.getId());
  }
}
