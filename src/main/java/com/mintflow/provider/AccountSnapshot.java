package com.mintflow.provider;

import java.math.BigDecimal;

public record AccountSnapshot(
    String externalAccountId,
    String name,
    String officialName,
    String type,
    String subtype,
    String mask,
    BigDecimal currentBalance,
    BigDecimal availableBalance,
    BigDecimal creditLimit,
    String currency
) {
  public AccountSnapshot {
    externalAccountId = SnapshotValidationException.require(externalAccountId, "account_id");
    name = SnapshotValidationException.require(name, "name");
    if (currency == null || currency.isBlank()) {
      currency = "USD";
    }
  }
}
