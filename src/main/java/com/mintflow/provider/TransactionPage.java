package com.mintflow.provider;

import java.util.List;

public record TransactionPage(List<TransactionSnapshot> transactions, String nextCursor, boolean hasMore) {
  public TransactionPage {
    transactions = transactions == null ? List.of() : List.copyOf(transactions);
  }
}
