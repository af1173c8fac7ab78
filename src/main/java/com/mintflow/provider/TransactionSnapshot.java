package com.mintflow.provider;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One ledger entry as the provider reports it. The amount keeps the provider's sign; the raw
 * payload is the provider JSON kept for auditing.
 */
public record TransactionSnapshot(
    String externalTransactionId,
    String externalAccountId,
    BigDecimal amount,
    String currency,
    LocalDate date,
    String description,
    String merchantName,
    boolean pending,
    String rawPayload
) {
  public TransactionSnapshot {
    externalTransactionId = SnapshotValidationException.require(externalTransactionId, "transaction_id");
    externalAccountId = SnapshotValidationException.require(externalAccountId, "account_id");
    description = SnapshotValidationException.require(description, "name");
    if (amount == null) {
      throw new SnapshotValidationException("Transaction " + externalTransactionId + " is missing amount");
    }
    if (date == null) {
      throw new SnapshotValidationException("Transaction " + externalTransactionId + " is missing date");
    }
  }

  public String classificationText() {
    if (merchantName == null || merchantName.isBlank()) {
      return description.trim();
    }
    return (description + " " + merchantName).trim();
  }
}
