package com.mintflow.provider;

import java.util.List;

/**
 * Access to one external bank-data provider. Implementations translate provider payloads into
 * snapshots and provider failures into {@link ProviderException} subtypes.
 */
public interface ProviderClient {
  String getProviderId();

  List<AccountSnapshot> fetchAccounts(String credential);

  /**
   * An empty or null cursor starts a full initial fetch. {@code range} is set on every page of an
   * initial fetch and null for incremental pages; snapshots dated outside it are dropped.
   */
  TransactionPage fetchTransactions(String credential, String cursor, DateRange range);

  LinkToken createLinkToken(String userReference);

  TokenExchange exchangeToken(String publicToken);
}
