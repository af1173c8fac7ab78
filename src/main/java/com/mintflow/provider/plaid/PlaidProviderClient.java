package com.mintflow.provider.plaid;

import com.fasterxml.jackson.databind.JsonNode;
import com.mintflow.config.SyncProperties;
import com.mintflow.provider.AccountSnapshot;
import com.mintflow.provider.DateRange;
import com.mintflow.provider.LinkToken;
import com.mintflow.provider.ProviderClient;
import com.mintflow.provider.ProviderUnavailableException;
import com.mintflow.provider.SnapshotValidationException;
import com.mintflow.provider.TokenExchange;
import com.mintflow.provider.TransactionPage;
import com.mintflow.provider.TransactionSnapshot;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class PlaidProviderClient implements ProviderClient {
  private static final Logger log = LoggerFactory.getLogger(PlaidProviderClient.class);
  private static final String PROVIDER_ID = "plaid";
  private static final int PAGE_SIZE = 500;

  private final PlaidClient client;
  private final SyncProperties syncProperties;

  public PlaidProviderClient(PlaidClient client, SyncProperties syncProperties) {
    this.client = client;
    this.syncProperties = syncProperties;
  }

  @Override
  public String getProviderId() {
    return PROVIDER_ID;
  }

  @Override
  public List<AccountSnapshot> fetchAccounts(String credential) {
    JsonNode response = requireBody(client.getAccounts(credential), "/accounts/get");
    List<AccountSnapshot> snapshots = new ArrayList<>();
    for (JsonNode account : response.path("accounts")) {
      JsonNode balances = account.path("balances");
      snapshots.add(new AccountSnapshot(
          text(account, "account_id"),
          text(account, "name"),
          text(account, "official_name"),
          text(account, "type"),
          text(account, "subtype"),
          text(account, "mask"),
          amount(balances, "current"),
          amount(balances, "available"),
          amount(balances, "limit"),
          firstNonBlank(text(balances, "iso_currency_code"), text(balances, "unofficial_currency_code"))));
    }
    return snapshots;
  }

  @Override
  public TransactionPage fetchTransactions(String credential, String cursor, DateRange range) {
    JsonNode response = requireBody(client.syncTransactions(credential, cursor, PAGE_SIZE), "/transactions/sync");
    List<TransactionSnapshot> snapshots = new ArrayList<>();
    collect(response.path("added"), snapshots, range);
    collect(response.path("modified"), snapshots, range);
    int removed = response.path("removed").size();
    if (removed > 0) {
      log.debug("Plaid reported {} removed transactions; history is kept", removed);
    }
    String nextCursor = text(response, "next_cursor");
    if (nextCursor == null) {
      throw new SnapshotValidationException("Provider payload is missing next_cursor");
    }
    return new TransactionPage(snapshots, nextCursor, response.path("has_more").asBoolean(false));
  }

  @Override
  public LinkToken createLinkToken(String userReference) {
    JsonNode response = requireBody(client.createLinkToken(userReference, syncProperties.lookbackDays()),
        "/link/token/create");
    String token = text(response, "link_token");
    if (token == null) {
      throw new SnapshotValidationException("Provider payload is missing link_token");
    }
    String expiration = text(response, "expiration");
    try {
      return new LinkToken(token, expiration == null ? null : Instant.parse(expiration));
    } catch (DateTimeParseException ex) {
      throw new SnapshotValidationException("Provider payload has a malformed expiration: " + expiration);
    }
  }

  @Override
  public TokenExchange exchangeToken(String publicToken) {
    JsonNode exchange = requireBody(client.exchangePublicToken(publicToken), "/item/public_token/exchange");
    String accessToken = text(exchange, "access_token");
    if (accessToken == null) {
      throw new SnapshotValidationException("Provider payload is missing access_token");
    }
    String itemId = text(exchange, "item_id");
    JsonNode item = requireBody(client.getItem(accessToken), "/item/get").path("item");
    String institutionId = text(item, "institution_id");
    if (institutionId == null) {
      throw new SnapshotValidationException("Provider payload is missing institution_id");
    }
    String institutionName = institutionName(institutionId);
    return new TokenExchange(accessToken, institutionId, institutionName, itemId);
  }

  private String institutionName(String institutionId) {
    try {
      JsonNode institution = client.getInstitution(institutionId);
      return institution == null ? null : text(institution.path("institution"), "name");
    } catch (ProviderUnavailableException ex) {
      log.info("Institution lookup for {} failed, keeping the id only: {}", institutionId, ex.getMessage());
      return null;
    }
  }

  private void collect(JsonNode array, List<TransactionSnapshot> into, DateRange range) {
    if (array == null || !array.isArray()) {
      return;
    }
    for (JsonNode tx : array) {
      TransactionSnapshot snapshot = new TransactionSnapshot(
          text(tx, "transaction_id"),
          text(tx, "account_id"),
          amount(tx, "amount"),
          firstNonBlank(text(tx, "iso_currency_code"), text(tx, "unofficial_currency_code")),
          parseDate(text(tx, "date")),
          firstNonBlank(text(tx, "name"), text(tx, "original_description")),
          text(tx, "merchant_name"),
          tx.path("pending").asBoolean(false),
          tx.toString());
      if (range != null && !range.contains(snapshot.date())) {
        continue;
      }
      into.add(snapshot);
    }
  }

  private static JsonNode requireBody(JsonNode body, String path) {
    if (body == null) {
      throw new ProviderUnavailableException("Plaid " + path + " returned an empty body");
    }
    return body;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull()) {
      return null;
    }
    String text = value.asText();
    return text.isBlank() ? null : text;
  }

  private static BigDecimal amount(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isNumber()) {
      return value.decimalValue();
    }
    if (value.isTextual()) {
      try {
        return new BigDecimal(value.asText());
      } catch (NumberFormatException ex) {
        throw new SnapshotValidationException("Provider payload has a malformed " + field + ": " + value.asText());
      }
    }
    return null;
  }

  private static LocalDate parseDate(String value) {
    if (value == null) {
      return null;
    }
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException ex) {
      throw new SnapshotValidationException("Provider payload has a malformed date: " + value);
    }
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }
}
