package com.mintflow.model;

import java.math.BigDecimal;

/**
 * How the provider signs transaction amounts. Plaid reports money leaving the account as a
 * positive amount.
 */
public enum AmountSignConvention {
  POSITIVE_IS_DEBIT,
  NEGATIVE_IS_DEBIT;

  public TransactionDirection directionOf(BigDecimal amount) {
    boolean positive = amount.signum() > 0;
    if (this == POSITIVE_IS_DEBIT) {
      return positive ? TransactionDirection.DEBIT : TransactionDirection.CREDIT;
    }
    return amount.signum() < 0 ? TransactionDirection.DEBIT : TransactionDirection.CREDIT;
  }
}
